package edu.colorado.clear.parse.tools;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import edu.colorado.clear.parse.tree.ParseException;
import edu.colorado.clear.parse.tree.TreeFileReader;
import edu.colorado.clear.parse.util.FileUtil;

/**
 * Reads every tree of the treebank files and reports the malformed ones.
 */
public class VerifyTrees {

    private static Logger logger = Logger.getLogger(VerifyTrees.class.getPackage().getName());

    @Option(name="-dir",usage="input directory or file",required=true)
    private File treeDir = null;

    @Option(name="-regex",usage="regular expression matching the files (default .*\\.(parse|mrg)(\\.gz)?)")
    private String regex = ".*\\.(parse|mrg)(\\.gz)?";

    @Option(name="-h",usage="help message")
    private boolean help = false;

    /**
     * @return number of files with errors
     */
    int verify() {
        int errors = 0;
        List<String> fileNames = FileUtil.getFiles(treeDir, regex);
        String dirName = treeDir.isDirectory()?treeDir.getPath():treeDir.getAbsoluteFile().getParent();

        for (String fName:fileNames) {
            logger.info("Processing "+fName);
            int count = 0;
            try (TreeFileReader reader = new TreeFileReader(dirName, fName)) {
                while (reader.nextTree()!=null)
                    ++count;
                logger.info(fName+": "+count+" trees");
            } catch (ParseException e) {
                logger.severe(e.getMessage());
                ++errors;
            } catch (IOException e) {
                logger.severe(fName+": "+e.getMessage());
                ++errors;
            }
        }
        return errors;
    }

	public static void main(String[] args) throws Exception {

		VerifyTrees options = new VerifyTrees();
        CmdLineParser cmdParser = new CmdLineParser(options);

        try {
            cmdParser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println("invalid options:"+e);
            cmdParser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help){
            cmdParser.printUsage(System.err);
            System.exit(0);
        }

        if (options.verify()>0)
            System.exit(1);
	}
}
