package name.monarchy.sim;

import name.monarchy.EngineConfig;
import name.monarchy.InvalidInputException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class SimMainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void parsesEveryOption() {
        SimMain.Options o = SimMain.parse(new String[] {
                "--games", "3", "--seed", "-9", "--turns", "12", "--threads", "2",
                "--out", "runs", "--label", "smoke", "--allow-war-required"});

        assertEquals(3, o.games);
        assertEquals(Long.valueOf(-9L), o.seed);
        assertEquals(Integer.valueOf(12), o.turns);
        assertEquals(Integer.valueOf(2), o.threads);
        assertEquals(Path.of("runs"), o.out);
        assertEquals("smoke", o.label);
        assertTrue(o.allowWarRequired);
        assertNull(o.config);
    }

    @Test
    public void unsetOptionsKeepDefaults() {
        SimMain.Options o = SimMain.parse(new String[0]);
        assertEquals(10, o.games);
        assertNull(o.seed);
        assertNull(o.turns);
        assertFalse(o.allowWarRequired);
    }

    @Test(expected = InvalidInputException.class)
    public void unknownOption() {
        SimMain.parse(new String[] {"--fast"});
    }

    @Test(expected = InvalidInputException.class)
    public void badNumber() {
        SimMain.parse(new String[] {"--games", "many"});
    }

    @Test(expected = InvalidInputException.class)
    public void missingValue() {
        SimMain.parse(new String[] {"--seed"});
    }

    @Test(expected = InvalidInputException.class)
    public void zeroTurns() {
        SimMain.parse(new String[] {"--turns", "0"});
    }

    @Test
    public void optionsOverrideConfig() {
        EngineConfig c = EngineConfig.defaults();
        SimMain.apply(SimMain.parse(new String[] {"--seed", "5", "--turns", "9", "--allow-war-required"}), c);

        assertEquals(5L, c.seed);
        assertEquals(9, c.maxTurns);
        assertEquals(1, c.threads);
        assertTrue(c.allowAttacksWhenWarRequired);
    }

    @Test
    public void usageErrorsExitWithTwo() {
        assertEquals(SimMain.EXIT_USAGE, SimMain.run(new String[] {"--games", "-1"}));
        assertEquals(SimMain.EXIT_USAGE, SimMain.run(new String[] {"--nope"}));
    }

    @Test
    public void smallBatchWritesOneRun() throws Exception {
        File out = tmp.newFolder("sims");
        int code = SimMain.run(new String[] {
                "--games", "2", "--turns", "5", "--out", out.getPath(), "--label", "t"});

        assertEquals(SimMain.EXIT_OK, code);
        File[] runs = out.listFiles();
        assertNotNull(runs);
        assertEquals(1, runs.length);
        assertTrue(new File(runs[0], "run_meta.json").isFile());
        assertTrue(new File(runs[0], "steps.csv").isFile());
    }
}
