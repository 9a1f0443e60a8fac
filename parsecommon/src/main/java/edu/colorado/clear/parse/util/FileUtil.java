package edu.colorado.clear.parse.util;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public class FileUtil
{
    /**
     * Lists the files under a directory, recursively, whose names match the
     * regular expression. Hidden directories are skipped.
     * @return paths relative to <code>dir</code>, sorted
     */
    static public List<String> getFiles(File dir, String regex)
    {
        return getFiles(dir, regex, false);
    }

    static public List<String> getFiles(File dir, String regex, boolean fullName)
    {
        List<String> fileNames = new ArrayList<String>();
        if (!dir.isDirectory())
        {
            if (Pattern.matches(regex, dir.getName()))
                fileNames.add(fullName?dir.getAbsolutePath():dir.getName());
            return fileNames;
        }

        File[] files = dir.listFiles();
        if (files==null)
            return fileNames;
        Arrays.sort(files);

        for (File file:files)
        {
            if (file.isDirectory())
            {
                if (file.getName().startsWith("."))
                    continue;
                for (String fileName:getFiles(file, regex, fullName))
                    fileNames.add(fullName?fileName:file.getName()+File.separatorChar+fileName);
            }
            else if (Pattern.matches(regex, file.getName()))
                fileNames.add(fullName?file.getAbsolutePath():file.getName());
        }
        return fileNames;
    }
}
