package edu.colorado.clear.parse.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PropertyUtil {

    /**
     * Loads a properties file and resolves environment variables in it.
     * @see #resolveEnvironmentVariables(Properties)
     */
    public static Properties load(String fileName) throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(fileName)) {
            props.load(in);
        }
        return resolveEnvironmentVariables(props);
    }

	/**
	 * Filters properties (does not inherit other properties)
	 * @see #filterProperties(Properties, String, boolean)
	 * @param in input properties object
	 * @param filter property names to filter
	 * @return filtered properties
	 */
	public static Properties filterProperties(Properties in, String filter)
	{
		return filterProperties(in, filter, false);
	}

	/**
	 * Filters properties. Takes the input properties and return a properties
	 * object that truncates the property names beginning w/ the filter. If
	 * inherit is specified, other properties are also returned intact,
	 * unless the property name conflict with a filtered property, then the
	 * value will be of the filtered property.
	 * @param in input properties object
	 * @param filter property names that begin w/ the filter are returned with the filter part truncated
	 * @param inherit whether to inherit properties that does not begin w/ the filter
	 * @return filtered properties
	 */
    public static Properties filterProperties(Properties in, String filter, boolean inherit)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
            if (propName.startsWith(filter))
                out.setProperty(propName.substring(filter.length()), in.getProperty(propName));

        if (inherit)
            for (String propName:in.stringPropertyNames())
                if (out.getProperty(propName) == null)
                    out.setProperty(propName, in.getProperty(propName));

        return out;
    }

    // match ${ENV_VAR_NAME}
    static final Pattern p = Pattern.compile("\\$\\{(\\w+)\\}");

    /**
     * Returns a new properties object that resolves environment variables
     * in the property values. Environment variables should be specified in
     * the ${ENV_VAR_NAME} form; undefined variables resolve to an empty string.
     * @param in input properties object
     * @return filtered properties
     */
    public static Properties resolveEnvironmentVariables(Properties in)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
        {
        	Matcher m = p.matcher(in.getProperty(propName));
        	StringBuffer sb = new StringBuffer();
        	while(m.find()){
        		String envVarValue = System.getenv(m.group(1));
        		m.appendReplacement(sb, null == envVarValue ? "" : Matcher.quoteReplacement(envVarValue));
        	}
        	m.appendTail(sb);

        	out.setProperty(propName, sb.toString());
        }

        return out;
    }

    public static String toString(Properties props)
    {
    	StringBuilder builder = new StringBuilder();

        String[] keys = props.stringPropertyNames().toArray(new String[0]);
        Arrays.sort(keys);
        for(String key:keys)
            builder.append(key+" = "+props.getProperty(key)+"\n");
        return builder.toString();
    }
}
