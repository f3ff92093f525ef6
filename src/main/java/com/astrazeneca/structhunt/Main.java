package com.astrazeneca.structhunt;

import com.astrazeneca.structhunt.data.RunStatus;
import com.astrazeneca.structhunt.exception.ConfigurationException;
import com.astrazeneca.structhunt.exception.WrongInputException;
import org.apache.commons.cli.ParseException;

public class Main {
    /**
     * Runs StructHunt and exits with 0 on success, 2 when some predictor partitions failed and 1 on failure.
     * @param args array of arguments from command line
     * @throws ParseException if command line options can't be parsed
     */
    public static void main(String[] args) throws ParseException {
        Configuration config = new CmdParser().parseParams(args);
        RunStatus status;
        try {
            status = new StructHuntLauncher().start(config);
        } catch (ConfigurationException | WrongInputException e) {
            System.err.println(e.getMessage());
            status = RunStatus.FAILURE;
        }
        System.exit(status.exitCode);
    }
}
