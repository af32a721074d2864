package hssp.sequences.io.test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import hssp.alignments.AlignmentFormatException;
import hssp.sequences.AlignedSequence;
import hssp.sequences.SequenceAlignment;
import hssp.sequences.io.StockholmAlignmentProvider;
import hssp.sequences.io.StockholmFileReader;
import junit.framework.TestCase;

public class StockholmFileReaderTest extends TestCase {

	private static final String ALIGNMENT = "# STOCKHOLM 1.0\n"
			+ "#=GF ID query-i1\n"
			+ "#=GS hit1/1-20 DE Hit one protein\n"
			+ "#=GS hit2/3-22 DE Unrelated\n"
			+ "\n"
			+ "query     MKTAYIAKQR\n"
			+ "hit1/1-20 MKTAYIAKQR\n"
			+ "hit2/3-22 WWWWWWWWWW\n"
			+ "hit3/5-20 ----YIAKQR\n"
			+ "#=GC RF   xxxxxxxxxx\n"
			+ "\n"
			+ "query     QISFVKSHFS\n"
			+ "hit1/1-20 QISFVKSHFS\n"
			+ "hit2/3-22 WWWWWWWWWW\n"
			+ "hit3/5-20 QISFVKSHFS\n"
			+ "//\n";

	public void testRead() throws IOException {
		SequenceAlignment aln = read(ALIGNMENT, true);
		assertEquals(3, aln.size());
		assertEquals(20, aln.getLength());
		assertEquals("query", aln.getQuery().getId());
		assertEquals("MKTAYIAKQRQISFVKSHFS", aln.getQuery().getResidues());
		AlignedSequence hit1 = aln.get(1);
		assertEquals("hit1/1-20", hit1.getId());
		assertEquals("Hit one protein", hit1.getDescription());
		assertEquals(20, hit1.getIdenticalCount());
		assertEquals(20, hit1.getAlignedLength());
		AlignedSequence hit3 = aln.get("hit3/5-20");
		assertNotNull(hit3);
		assertEquals("----YIAKQRQISFVKSHFS", hit3.getResidues());
		assertEquals(16, hit3.getIdenticalCount());
		assertEquals(20, hit3.getAlignedLength());
		assertEquals(0.8, hit3.getIdentity(), 0.0001);
		assertNull(aln.get("hit2/3-22"));
	}

	public void testReadWithoutFilter() throws IOException {
		SequenceAlignment aln = read(ALIGNMENT, false);
		assertEquals(4, aln.size());
		assertEquals("hit2/3-22", aln.get(2).getId());
		assertEquals(0, aln.get(2).getIdenticalCount());
	}

	public void testFormatErrors() throws IOException {
		assertFormatError("# STOCKHOLM 2.0\n#=GF ID q\nq AAA\nh AAA\n//\n");
		assertFormatError("# STOCKHOLM 1.0\nq AAA\nh AAA\n//\n");
		// Only the query
		assertFormatError("# STOCKHOLM 1.0\n#=GF ID q\nq MKTAYIAKQR\n//\n");
		// Block shorter than the query block
		assertFormatError("# STOCKHOLM 1.0\n#=GF ID q\nq MKTAYIAKQR\nh MKTAYIAKQ\n//\n");
		// Data line without residues
		assertFormatError("# STOCKHOLM 1.0\n#=GF ID q\nq MKTAYIAKQR\nh\n//\n");
	}

	public void testStripIterationSuffix() {
		assertEquals("query", StockholmFileReader.stripIterationSuffix("query-i3"));
		assertEquals("query", StockholmFileReader.stripIterationSuffix("query-i12"));
		assertEquals("query-x1", StockholmFileReader.stripIterationSuffix("query-x1"));
		assertEquals("abc", StockholmFileReader.stripIterationSuffix("abc"));
	}

	public void testProvider() throws IOException {
		StockholmAlignmentProvider provider = new StockholmAlignmentProvider();
		provider.addFile('A', "./dataTest/example.sto");
		assertTrue(provider.hasAlignment('A'));
		assertFalse(provider.hasAlignment('B'));
		try {
			provider.addFile('A', "./dataTest/other.sto");
			fail("Duplicated chain should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		SequenceAlignment aln = provider.getAlignment('A', "MKTAYIAKQRQISFVKSHFSRQLEERLGLIEVQAPILSRV");
		assertEquals(3, aln.size());
		assertEquals(42, aln.getLength());
		assertEquals("Example homolog", aln.get("UniRef100_P12345/5-45").getDescription());
	}

	private static SequenceAlignment read(String text, boolean filter) throws IOException {
		try (StockholmFileReader reader = new StockholmFileReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.US_ASCII)))) {
			reader.setFilterNonHomologous(filter);
			return reader.read();
		}
	}

	private static void assertFormatError(String text) throws IOException {
		try {
			read(text, true);
			fail("Invalid alignment should not be loaded: "+text);
		} catch (AlignmentFormatException e) {
			// Expected
		}
	}
}
