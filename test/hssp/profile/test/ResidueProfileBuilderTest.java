package hssp.profile.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import hssp.alignments.Hit;
import hssp.alignments.InvalidAlignmentException;
import hssp.alignments.ScoreTrimHitBuilder;
import hssp.profile.ResidueHInfo;
import hssp.profile.ResidueProfileBuilder;
import hssp.proteins.ChainResidue;
import hssp.proteins.ProteinChain;
import hssp.sequences.Aminoacids;
import junit.framework.TestCase;

public class ResidueProfileBuilderTest extends TestCase {

	public void testConservedColumn() {
		ResidueProfileBuilder builder = new ResidueProfileBuilder();
		ResidueHInfo info = builder.buildProfile('A', 'A', 7, 0, Arrays.asList("A", "A", "A", "A", "-"));
		assertEquals(4, info.getNocc());
		assertEquals(1, info.getNdel());
		assertEquals(0, info.getNins());
		assertEquals(100, info.getPercentage('A'));
		assertEquals(0, info.getPercentage('V'));
		assertEquals(0.0, info.getEntropy(), 0.0001);
		assertEquals(0, info.getRelativeEntropy());
		assertEquals(7, info.getPdbNr());
	}

	public void testMixedColumn() {
		ResidueProfileBuilder builder = new ResidueProfileBuilder();
		ResidueHInfo info = builder.buildProfile('L', 'A', 1, 0, Arrays.asList("L", "L", "V", "I", "l", " ", "X"));
		assertEquals(5, info.getNocc());
		assertEquals(0, info.getNdel());
		assertEquals(60, info.getPercentage('L'));
		assertEquals(20, info.getPercentage('V'));
		assertEquals(20, info.getPercentage('I'));
		int sum = 0;
		for(int p:info.getDistribution()) sum+=p;
		assertTrue(sum>=99 && sum<=101);
		double expected = -(0.6*Math.log(0.6)+0.4*Math.log(0.2));
		assertEquals(expected, info.getEntropy(), 0.0001);
		assertEquals((int)Math.round(100*expected/Math.log(20)), info.getRelativeEntropy());
	}

	public void testUnknownQueryResidue() throws Exception {
		ProteinChain chain = buildChain('A', "MKXLA", new int [] {1, 2, 3, 4, 5});
		List<Hit> hits = new ArrayList<Hit>();
		hits.add(new ScoreTrimHitBuilder().buildHit("MKXLA", "h1", "MKALA"));
		List<ResidueHInfo> infos = new ResidueProfileBuilder().buildProfiles(chain, "MKXLA", hits);
		ResidueHInfo x = infos.get(2);
		assertEquals('X', x.getLetter());
		assertEquals(1, x.getNocc());
		assertEquals(100, x.getPercentage('A'));
		int sum = 0;
		for(int p:x.getDistribution()) sum+=p;
		assertEquals(100, sum);
		assertEquals(2, infos.get(3).getNocc());

		// Column without any countable residue
		ResidueHInfo empty = new ResidueProfileBuilder().buildProfile('X', 'A', 3, 0, Arrays.asList("X", "-", " "));
		assertEquals(0, empty.getNocc());
		for(int p:empty.getDistribution()) assertEquals(0, p);
		assertEquals(0.0, empty.getEntropy(), 0.0001);
	}

	public void testChainBreaks() throws Exception {
		ProteinChain chain = buildChain('A', "MKVLA", new int [] {1, 2, 3, 10, 11});
		List<Hit> hits = new ArrayList<Hit>();
		hits.add(new ScoreTrimHitBuilder().buildHit("MKVLA", "h1", "MKVLA"));
		List<ResidueHInfo> infos = new ResidueProfileBuilder().buildProfiles(chain, "MKVLA", hits);
		assertEquals(6, infos.size());
		for(int i=0;i<infos.size();i++) assertEquals(i+1, infos.get(i).getSeqNr());
		assertFalse(infos.get(2).isChainBreak());
		assertTrue(infos.get(3).isChainBreak());
		ResidueHInfo last = infos.get(5);
		assertEquals('A', last.getLetter());
		assertEquals(11, last.getPdbNr());
		assertEquals(2, last.getNocc());
		assertEquals(1.0, last.getConservation(), 0.0001);
		assertEquals(0, last.getVariability());
		assertEquals(34, last.getDsspFragment().length());
	}

	public void testInsertionCount() throws Exception {
		ProteinChain chain = buildChain('B', "MKVLA", new int [] {1, 2, 3, 4, 5});
		List<Hit> hits = new ArrayList<Hit>();
		Hit hit = new ScoreTrimHitBuilder().buildHit("MKV-LA", "h1", "MKVWLA");
		assertEquals("MKvWlA", hit.getAlignedResidues());
		hits.add(hit);
		List<ResidueHInfo> infos = new ResidueProfileBuilder().buildProfiles(chain, "MKV-LA", hits);
		assertEquals(5, infos.size());
		ResidueHInfo v = infos.get(2);
		assertEquals('V', v.getLetter());
		assertEquals(1, v.getNins());
		assertEquals(2, v.getNocc());
		assertEquals(100, v.getPercentage('V'));
		ResidueHInfo l = infos.get(3);
		assertEquals(4, l.getColumnIndex());
		assertEquals(0, l.getNins());
		assertEquals(100, l.getPercentage('L'));
	}

	public void testMismatches() {
		ProteinChain chain = buildChain('A', "MKVLA", new int [] {1, 2, 3, 4, 5});
		List<Hit> hits = new ArrayList<Hit>();
		ResidueProfileBuilder builder = new ResidueProfileBuilder();
		try {
			builder.buildProfiles(chain, "MKVLG", hits);
			fail("Query with a different residue should not be accepted");
		} catch (InvalidAlignmentException e) {
			// Expected
		}
		try {
			builder.buildProfiles(chain, "MKV-L", hits);
			fail("Query shorter than the chain should not be accepted");
		} catch (InvalidAlignmentException e) {
			// Expected
		}
	}

	private static ProteinChain buildChain(char id, String sequence, int [] pdbNumbers) {
		ProteinChain chain = new ProteinChain(id);
		for(int i=0;i<sequence.length();i++) {
			StringBuilder fragment = new StringBuilder(String.format("%5d %c %c", pdbNumbers[i], id, sequence.charAt(i)));
			while(fragment.length()<34) fragment.append(' ');
			chain.addResidue(new ChainResidue(pdbNumbers[i], sequence.charAt(i), fragment.toString()));
		}
		assertEquals(Aminoacids.removeGaps(sequence), chain.getSequence());
		return chain;
	}
}
