package tagcount.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import tagcount.util.help.HelpConstants;

/**
 * Tools that locate barcode tags in sequencing reads and tabulate them per sample
 */
public class TagCountingProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_TAG_COUNTING; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_TAG_COUNTING_SUMMARY; }
}
