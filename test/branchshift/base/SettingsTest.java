package branchshift.base;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.util.Random;

import org.junit.jupiter.api.Test;

import branchshift.model.RateShiftModel;

class SettingsTest {

    @Test
    void defaults() {
        Settings settings = new Settings();
        assertNull(settings.treefile);
        assertFalse(settings.initializeModel);
        assertEquals(0.05, settings.updateEventLocationScale);
        assertEquals(4.0, settings.updateEventRateScale);
        assertEquals(10.0, settings.localGlobalMoveRatio);
        assertEquals(1.0, settings.poissonRatePrior);
        assertEquals(1.0, settings.eventRateParameterPrior);
    }

    @Test
    void controlFileOverridesDefaults() throws IOException {
        String control = "# a run\n"
                + "treefile = whales.tre\n"
                + "\n"
                + "eventDataInfile=seed.txt\n"
                + "initializeModel = 1\n"
                + "seed = 12345\n"
                + "numberOfGenerations = 200\n"
                + "printFreq = 50\n"
                + "updateEventLocationScale = 0.1\n"
                + "poissonRatePrior = 2.0\n"
                + "updateRateEventRate = 0.5\n"
                + "validateEventConfiguration = true\n"
                + "someFutureOption = 3\n";
        Settings settings = Settings.load(new StringReader(control));

        assertEquals("whales.tre", settings.treefile);
        assertEquals("seed.txt", settings.eventDataInfile);
        assertTrue(settings.initializeModel);
        assertEquals(12345L, settings.seed);
        assertEquals(200, settings.numberOfGenerations);
        assertEquals(50, settings.printFreq);
        assertEquals(0.1, settings.updateEventLocationScale);
        assertEquals(2.0, settings.poissonRatePrior);
        assertEquals(0.5, settings.updateRateEventRate);
        assertTrue(settings.validateEventConfiguration);
        assertEquals(1.0, settings.updateRateEventNumber);
    }

    @Test
    void badLines() {
        assertThrows(IllegalArgumentException.class, () -> Settings.load(new StringReader("treefile whales.tre\n")));
        assertThrows(IllegalArgumentException.class, () -> Settings.load(new StringReader("seed = many\n")));
        assertThrows(IllegalArgumentException.class, () -> Settings.load(new StringReader("initializeModel = maybe\n")));
    }

    @Test
    void startingRateFollowsThePrior() throws IOException {
        Settings settings = Settings.load(new StringReader("poissonRatePrior = 4.0\n"));
        RateShiftModel model = new RateShiftModel(new Random(1), new Tree(TestTrees.SMALL), settings);
        assertEquals(0.25, model.getEventRate());
    }
}
