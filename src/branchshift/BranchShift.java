package branchshift;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

import branchshift.base.Mcmc;
import branchshift.base.SeedFileException;
import branchshift.base.Settings;
import branchshift.base.Tree;
import branchshift.model.RateEvent;
import branchshift.model.RateShiftModel;

/**
 * Command line entry point: {@code BranchShift <control-file>}.
 *
 * Reads the settings and the tree, optionally seeds the chain from an event
 * data file and runs the sampler. Any setup error ends the process.
 */
public class BranchShift {

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: BranchShift <control-file>");
            System.exit(1);
        }

        try {
            run(Paths.get(args[0]));
        } catch (SeedFileException e) {
            System.err.println("Error in event data file: " + e.getMessage());
            System.exit(1);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Cannot set up the run:");
            e.printStackTrace();
            System.exit(1);
        }
    }

    static RateShiftModel run(Path controlFile) throws IOException, SeedFileException {
        Settings settings;
        try (Reader in = Files.newBufferedReader(controlFile, StandardCharsets.UTF_8)) {
            settings = Settings.load(in);
        }
        if (settings.treefile == null)
            throw new IllegalArgumentException("No treefile given in " + controlFile);

        // relative paths are resolved against the control file
        Path base = controlFile.toAbsolutePath().getParent();
        Tree tree = Tree.read(base.resolve(settings.treefile));
        System.out.println("Read tree with " + tree.getNumberOfNodes() + " nodes, total length "
                + tree.getTotalMapLength());

        if (settings.eventDataInfile != null)
            settings.eventDataInfile = base.resolve(settings.eventDataInfile).toString();

        RateShiftModel model = new RateShiftModel(new Random(settings.seed), tree, settings);
        if (settings.initializeModel)
            model.initializeModelFromEventDataFile();

        Mcmc<RateEvent> mcmc = new Mcmc<RateEvent>(model, settings);
        mcmc.run();
        return model;
    }
}
