package tagcount.cmdline;

import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;
import tagcount.barcode.CountBarcodeTags;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class TagCountCommandLineTest {

    // cache all the command line programs once so we don't have to rediscover them for each test
    private static final Map<Class<CommandLineProgram>, CommandLineProgramProperties> allCLPS = new HashMap<>();

    @BeforeClass
    public static void getAllCommandLineProgramClasses() {
        TagCountCommandLine.processAllCommandLinePrograms(
                TagCountCommandLine.getPackageList(),
                (Class<CommandLineProgram> clazz, CommandLineProgramProperties clProperties) -> allCLPS.put(clazz, clProperties));
        Assert.assertTrue(allCLPS.size() > 0);
    }

    @Test
    public void testCountBarcodeTagsIsDiscovered() {
        Assert.assertTrue(allCLPS.containsKey(CountBarcodeTags.class));
    }

    @Test
    public void testAllProgramsAreAnnotated() {
        allCLPS.forEach((clazz, properties) -> {
            Assert.assertNotNull(properties, clazz.getSimpleName());
            Assert.assertTrue(properties.oneLineSummary().length() <= CommandLineProgram.MAX_ALLOWABLE_ONE_LINE_SUMMARY_LENGTH,
                    clazz.getSimpleName());
        });
    }

    // Instantiates every program and builds a Barclay parser for it, which rejects duplicate or malformed arguments.
    @Test
    public void testLaunchAllCommandLineProgramsWithBarclayParser() throws Exception {
        for (final Class<CommandLineProgram> clazz : allCLPS.keySet()) {
            final CommandLineProgram clp = clazz.getDeclaredConstructor().newInstance();
            new CommandLineArgumentParser(clp, Collections.emptyList(), Collections.emptySet());
        }
    }

    @Test
    public void testNoProgramNameGivesUsage() {
        Assert.assertEquals(new TagCountCommandLine().instanceMain(new String[0]), 1);
    }

    @Test
    public void testUnknownProgram() {
        Assert.assertEquals(new TagCountCommandLine().instanceMain(new String[]{"CountBarcodeTag"}), 1);
    }
}
