package hssp.report.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import hssp.alignments.AlignmentProvider;
import hssp.alignments.Hit;
import hssp.alignments.HitBuilder;
import hssp.alignments.Insertion;
import hssp.alignments.InvalidAlignmentException;
import hssp.databank.DatabankEntry;
import hssp.databank.TabularSequenceDatabank;
import hssp.profile.ResidueHInfo;
import hssp.proteins.ChainResidue;
import hssp.proteins.Protein;
import hssp.proteins.ProteinChain;
import hssp.proteins.io.DSSPFileReader;
import hssp.proteins.io.FastaProteinReader;
import hssp.report.HSSPReport;
import hssp.report.HSSPReportBuilder;
import hssp.report.io.HSSPFileWriter;
import hssp.sequences.AlignedSequence;
import hssp.sequences.SequenceAlignment;
import hssp.sequences.io.StockholmAlignmentProvider;
import junit.framework.TestCase;

public class HSSPReportBuilderTest extends TestCase {

	public void testRestrictToChain() throws Exception {
		List<AlignedSequence> seqs = new ArrayList<AlignedSequence>();
		seqs.add(new AlignedSequence("query", "MKVL-AGIVLAWW"));
		seqs.add(new AlignedSequence("h/3-15", "MKVLWAGIVLAWW"));
		SequenceAlignment aln = new SequenceAlignment(seqs);
		SequenceAlignment sub = HSSPReportBuilder.restrictToChain(aln, "AGIVL");
		assertEquals(5, sub.getLength());
		assertEquals("AGIVL", sub.getQuery().getResidues());
		assertEquals("AGIVL", sub.get(1).getResidues());
		assertEquals(5, sub.get(1).getLeadingResidues());
		assertEquals(3, sub.get(1).getTrailingResidues());
		List<Hit> hits = HitBuilder.getInstance("profile").buildHits(sub, 'A');
		assertEquals(1, hits.size());
		Hit hit = hits.get(0);
		assertEquals("h", hit.getId());
		assertEquals(1, hit.getIfir());
		assertEquals(5, hit.getIlas());
		assertEquals(8, hit.getJfir());
		assertEquals(12, hit.getJlas());

		assertSame(aln, HSSPReportBuilder.restrictToChain(aln, "MKVLAGIVLAWW"));
		try {
			HSSPReportBuilder.restrictToChain(aln, "AGWVL");
			fail("Chain not contained in the query should not be accepted");
		} catch (InvalidAlignmentException e) {
			// Expected
		}
	}

	public void testAnnotateHits() {
		HSSPReportBuilder builder = new HSSPReportBuilder();
		builder.setDatabank(buildDatabank());
		List<Hit> hits = new ArrayList<Hit>();
		Hit uniref = new Hit("UniRef100_P12345");
		uniref.setJlas(45);
		uniref.setLseq2(45);
		hits.add(uniref);
		Hit plain = new Hit("hitA");
		plain.setJlas(50);
		hits.add(plain);
		Hit unknown = new Hit("UniRef100_Q99999");
		unknown.setDescription("From alignment");
		hits.add(unknown);
		builder.annotateHits(hits);
		assertEquals("P12345", uniref.getId());
		assertEquals("P12345", uniref.getAccession());
		assertEquals("Homolog from databank", uniref.getDescription());
		assertEquals(120, uniref.getLseq2());
		assertEquals("ACC_A", plain.getAccession());
		assertEquals("Protein A", plain.getDescription());
		assertEquals(50, plain.getLseq2());
		assertEquals("Q99999", unknown.getId());
		assertEquals("Q99999", unknown.getAccession());
		assertEquals("From alignment", unknown.getDescription());
	}

	public void testBuildReport() throws Exception {
		Protein protein = loadProtein();
		StockholmAlignmentProvider provider = new StockholmAlignmentProvider();
		provider.addFile('A', "./dataTest/example.sto");
		HSSPReportBuilder builder = new HSSPReportBuilder();
		builder.setDatabank(buildDatabank());
		HSSPReport report = builder.buildReport(protein, provider);

		assertEquals("1XYZ", report.getProteinId());
		assertEquals("UniRef100 2026_01", report.getDatabankVersion());
		assertEquals(4, report.getDescriptionLines().size());
		assertEquals(2, report.getNchain());
		assertEquals(1, report.getKchain());
		assertEquals("A", report.getUsedChainsList());
		assertEquals(40, report.getSeqLength());

		List<Hit> hits = report.getHits();
		assertEquals(2, hits.size());
		Hit first = hits.get(0);
		assertEquals("hitA", first.getId());
		assertEquals(1, first.getRank());
		assertEquals("ACC_A", first.getAccession());
		assertEquals(1.0, first.getIde(), 0.0001);
		assertEquals(40, first.getLali());
		assertEquals(0, first.getNgap());
		assertEquals(0, first.getLgap());

		Hit second = hits.get(1);
		assertEquals("P12345", second.getId());
		assertEquals(2, second.getRank());
		assertEquals('A', second.getChainId());
		assertEquals(39, second.getLali());
		assertEquals(37, second.getIdenticalCount());
		assertEquals(37.0/39, second.getIde(), 0.0001);
		assertEquals(1.0, second.getWsim(), 0.0001);
		assertEquals(2, second.getNgap());
		assertEquals(3, second.getLgap());
		assertEquals(1, second.getIfir());
		assertEquals(40, second.getIlas());
		assertEquals(5, second.getJfir());
		assertEquals(45, second.getJlas());
		assertEquals(120, second.getLseq2());
		assertEquals(1, second.getInsertions().size());
		Insertion ins = second.getInsertions().get(0);
		assertEquals(20, ins.getQueryPos());
		assertEquals(24, ins.getHitPos());
		assertEquals("sGGr", ins.getSequence());

		List<ResidueHInfo> residues = report.getResidues();
		assertEquals(41, residues.size());
		assertTrue(residues.get(20).isChainBreak());
		assertEquals(21, residues.get(20).getSeqNr());
		ResidueHInfo m = residues.get(0);
		assertEquals('M', m.getLetter());
		assertEquals(3, m.getNocc());
		assertEquals(100, m.getPercentage('M'));
		ResidueHInfo s = residues.get(19);
		assertEquals('S', s.getLetter());
		assertEquals(1, s.getNins());
		ResidueHInfo deleted = residues.get(30);
		assertEquals('I', deleted.getLetter());
		assertEquals(34, deleted.getPdbNr());
		assertEquals(31, deleted.getSeqNr());
		assertEquals(1, deleted.getNdel());
		assertEquals(2, deleted.getNocc());
		assertEquals(34, deleted.getDsspFragment().length());

		ByteArrayOutputStream os = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(os, true, "US-ASCII")) {
			new HSSPFileWriter().write(report, out);
		}
		String text = new String(os.toByteArray(), StandardCharsets.US_ASCII);
		assertTrue(text.contains("KCHAIN     0001 chain(s) used here ; chains(s) : A\n"));
		assertTrue(text.contains("00002 : P12345              0.95  1.00 0001 0040 0005 0045 0039 0002 0003 0120  P12345     Homolog from databank\n"));
		assertTrue(text.contains("  0002  0020  0024  0002 sGGr\n"));
	}

	public void testSkipFailedChains() throws Exception {
		Protein protein = loadProtein();
		ProteinChain c = new ProteinChain('C');
		String sequence = "WWWWWHHHHHWWWWWHHHHHWWWWWHHHHH";
		for(int i=0;i<sequence.length();i++) {
			c.addResidue(new ChainResidue(i+1, sequence.charAt(i), FastaProteinReader.buildFragment(i+1, 'C', sequence.charAt(i))));
		}
		protein.addChain(c);
		final StockholmAlignmentProvider files = new StockholmAlignmentProvider();
		files.addFile('A', "./dataTest/example.sto");
		AlignmentProvider provider = new AlignmentProvider() {
			@Override
			public boolean hasAlignment(char chainId) {
				return true;
			}
			@Override
			public SequenceAlignment getAlignment(char chainId, String chainSequence) throws IOException {
				if(chainId=='A') return files.getAlignment(chainId, chainSequence);
				// The alignment of chain C was calculated for a different query
				return files.getAlignment('A', chainSequence);
			}
		};
		HSSPReportBuilder builder = new HSSPReportBuilder();
		try {
			builder.buildReport(protein, provider);
			fail("Invalid alignment of chain C should stop the report");
		} catch (IOException e) {
			// Expected
		}
		builder.setSkipFailedChains(true);
		HSSPReport report = builder.buildReport(protein, provider);
		assertEquals(3, report.getNchain());
		assertEquals(1, report.getKchain());
		assertEquals(40, report.getSeqLength());
	}

	public void testShortChains() throws Exception {
		Protein protein = loadProtein();
		HSSPReportBuilder builder = new HSSPReportBuilder();
		builder.setMinLength(50);
		try {
			builder.buildReport(protein, new StockholmAlignmentProvider());
			fail("Protein without chains of the minimum length should not be processed");
		} catch (IOException e) {
			// Expected
		}
	}

	public void testMaxHits() throws Exception {
		Protein protein = loadProtein();
		StockholmAlignmentProvider provider = new StockholmAlignmentProvider();
		provider.addFile('A', "./dataTest/example.sto");
		HSSPReportBuilder builder = new HSSPReportBuilder();
		builder.setMaxHits("1");
		builder.setTrimmingPolicy(HitBuilder.POLICY_SCORE);
		HSSPReport report = builder.buildReport(protein, provider);
		assertEquals(1, report.getHits().size());
		assertEquals("hitA/1-40", report.getHits().get(0).getId());
	}

	public void testArguments() {
		HSSPReportBuilder builder = new HSSPReportBuilder();
		builder.addAlignmentFile("A=./dataTest/example.sto");
		try {
			builder.addAlignmentFile("A=./dataTest/other.sto");
			fail("Two alignments for the same chain should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			builder.addAlignmentFile("AB=./dataTest/example.sto");
			fail("Chain ids with more than one character should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			builder.addAlignmentFile("./dataTest/example.sto");
			fail("Missing chain should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			builder.setMaxHits(10000);
			fail("More than 9999 hits should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}

	private static Protein loadProtein() throws IOException {
		try (DSSPFileReader reader = new DSSPFileReader("./dataTest/example.dssp")) {
			return reader.read();
		}
	}

	private static TabularSequenceDatabank buildDatabank() {
		TabularSequenceDatabank databank = new TabularSequenceDatabank();
		databank.setVersion("UniRef100 2026_01");
		databank.addEntry(new DatabankEntry("hitA", "ACC_A", "Protein A", 40));
		databank.addEntry(new DatabankEntry("P12345", "P12345", "Homolog from databank", 120));
		return databank;
	}
}
