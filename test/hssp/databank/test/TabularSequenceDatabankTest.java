package hssp.databank.test;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import hssp.databank.DatabankEntry;
import hssp.databank.TabularSequenceDatabank;
import junit.framework.TestCase;

public class TabularSequenceDatabankTest extends TestCase {
	public void testLoad() throws IOException {
		TabularSequenceDatabank databank = new TabularSequenceDatabank();
		databank.load("./dataTest/example_databank.tsv");
		databank.setVersion("UniRef100 2026_01");
		assertEquals(3, databank.size());
		assertEquals("UniRef100 2026_01", databank.getVersion());
		DatabankEntry entry = databank.lookup("P12345");
		assertNotNull(entry);
		assertEquals("P12345", entry.getAccession());
		assertEquals("Homolog from databank", entry.getDescription());
		assertEquals(120, entry.getLength());
		assertEquals("", databank.lookup("Q00001").getDescription());
		assertNull(databank.lookup("UniRef100_P12345"));
	}
	public void testInvalidLength() throws IOException {
		File file = File.createTempFile("databank", ".tsv");
		file.deleteOnExit();
		try (PrintStream out = new PrintStream(file)) {
			out.println("P1\tP1\tlong\tInvalid");
		}
		try {
			new TabularSequenceDatabank().load(file.getAbsolutePath());
			fail("Invalid length should not be accepted");
		} catch (IOException e) {
			// Expected
		}
	}
}
