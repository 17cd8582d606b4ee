package org.theseed.bng.cli;

import java.util.Arrays;

/**
 * Commands for utilities relating to BNGL export of spatial models.
 *
 * export		write a spatial model as BNGL
 * stats		report on the species and reactant classes in use
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1)
            throw new RuntimeException("A command is required:  export or stats.");
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "export" :
            processor = new ExportProcessor();
            break;
        case "stats" :
            processor = new StatsProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
            if (! processor.isSucceeded())
                System.exit(1);
        }
    }
}
