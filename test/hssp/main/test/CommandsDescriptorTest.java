package hssp.main.test;

import hssp.main.Command;
import hssp.main.CommandOption;
import hssp.main.CommandsDescriptor;
import hssp.main.OptionValuesDecoder;
import hssp.report.HSSPReportBuilder;
import junit.framework.TestCase;

public class CommandsDescriptorTest extends TestCase {
	public void testDescriptor() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		assertEquals("1.0.0", descriptor.getSwVersion());
		Command c = descriptor.getCommand("BuildHSSP");
		assertNotNull(c);
		assertEquals(HSSPReportBuilder.class, c.getProgram());
		assertSame(c, descriptor.getCommandByClass(HSSPReportBuilder.class.getName()));
		CommandOption m = c.getOption("m");
		assertEquals(CommandOption.TYPE_INT, m.getType());
		assertEquals("25", m.getDefaultValue());
		assertTrue(c.getOption("skipFailedChains").isFlag());
		assertTrue(c.isMultiple("CHAIN=STOCKHOLM_FILE"));
	}
	public void testLoadOptions() throws Exception {
		HSSPReportBuilder builder = new HSSPReportBuilder();
		String [] args = {"-d", "protein.dssp", "-m", "30", "-skipFailedChains", "-p", "score", "-maxHits", "100", "-id", "1ABC", "A=chainA.sto", "B=chainB.sto"};
		int i = CommandsDescriptor.getInstance().loadOptions(builder, args);
		assertEquals(11, i);
		assertEquals("protein.dssp", builder.getDsspFile());
		assertEquals(30, builder.getMinLength());
		assertTrue(builder.isSkipFailedChains());
		assertEquals("score", builder.getTrimmingPolicy());
		assertEquals(100, builder.getMaxHits());
		assertEquals("1ABC", builder.getProteinId());
		assertNull(builder.getOutputFile());
	}
	public void testDecoder() {
		assertEquals(12, OptionValuesDecoder.decode("12", Integer.class));
		assertEquals(0.5, OptionValuesDecoder.decode("0.5", Double.class));
		assertEquals(Boolean.TRUE, OptionValuesDecoder.decode("true", Boolean.class));
		assertEquals('B', OptionValuesDecoder.decodeChainId("B"));
		try {
			OptionValuesDecoder.decodeChainId("");
			fail("Empty chain id should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}
}
