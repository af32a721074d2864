package hssp.alignments.test;

import java.util.ArrayList;
import java.util.List;

import hssp.alignments.AlignmentFormatException;
import hssp.alignments.Hit;
import hssp.alignments.HitBuilder;
import hssp.alignments.Insertion;
import hssp.alignments.InvalidAlignmentException;
import hssp.alignments.ProfileTrimHitBuilder;
import hssp.alignments.ScoreTrimHitBuilder;
import hssp.sequences.AlignedSequence;
import hssp.sequences.SequenceAlignment;
import junit.framework.TestCase;

public class HitBuilderTest extends TestCase {

	public void testDeletion() throws Exception {
		for(String policy:new String[] {HitBuilder.POLICY_PROFILE, HitBuilder.POLICY_SCORE}) {
			HitBuilder builder = HitBuilder.getInstance(policy);
			Hit hit = builder.buildHit("AAAGGG", "hit1/1-5", "AA-GGG");
			assertEquals("hit1", hit.getId().substring(0, 4));
			assertEquals(5, hit.getLali());
			assertEquals(1, hit.getNgap());
			assertEquals(1, hit.getLgap());
			assertEquals(5, hit.getIdenticalCount());
			assertEquals(1.0, hit.getIde(), 0.0001);
			assertEquals(1, hit.getIfir());
			assertEquals(6, hit.getIlas());
			assertEquals(1, hit.getJfir());
			assertEquals(5, hit.getJlas());
			assertEquals(0, hit.getInsertions().size());
			assertTrue(hit.isSignificant());
		}
	}

	public void testInsertion() throws Exception {
		Hit hit = new ScoreTrimHitBuilder().buildHit("MKV--LAG", "hit2", "MKVWWLAG");
		assertEquals("hit2", hit.getId());
		assertEquals(6, hit.getLali());
		assertEquals(1, hit.getNgap());
		assertEquals(2, hit.getLgap());
		assertEquals(6, hit.getIdenticalCount());
		assertEquals(1, hit.getIfir());
		assertEquals(6, hit.getIlas());
		assertEquals(1, hit.getJfir());
		assertEquals(8, hit.getJlas());
		assertEquals(8, hit.getLseq2());
		assertEquals("MKvWWlAG", hit.getAlignedResidues());
		List<Insertion> insertions = hit.getInsertions();
		assertEquals(1, insertions.size());
		Insertion ins = insertions.get(0);
		assertEquals(3, ins.getQueryPos());
		assertEquals(3, ins.getHitPos());
		assertEquals("vWWl", ins.getSequence());
		assertEquals(2, ins.getLength());
	}

	public void testProfileTrim() throws Exception {
		HitBuilder builder = new ProfileTrimHitBuilder();
		Hit hit = builder.buildHit("MKVLAGIVLA", "seqX/10-15", "--VLAGIV--");
		assertEquals("seqX", hit.getId());
		assertEquals(3, hit.getIfir());
		assertEquals(8, hit.getIlas());
		assertEquals(10, hit.getJfir());
		assertEquals(15, hit.getJlas());
		assertEquals(6, hit.getLali());
		assertEquals(0, hit.getNgap());
		assertEquals(15, hit.getLseq2());
		assertEquals("  VLAGIV  ", hit.getAlignedResidues());
		assertEquals(' ', hit.getAlignedResidue(0));
		assertEquals(' ', hit.getAlignedResidue(50));
		assertEquals('V', hit.getAlignedResidue(2));
	}

	public void testProfileTrimInvalidId() throws Exception {
		try {
			new ProfileTrimHitBuilder().buildHit("MKVLAGIVLA", "seqX", "MKVLAGIVLA");
			fail("Row id without domain limits should not be accepted");
		} catch (AlignmentFormatException e) {
			// Expected
		}
		int [] domain = ProfileTrimHitBuilder.parseDomain("UniRef100_Q1/25-130");
		assertEquals(25, domain[0]);
		assertEquals(130, domain[1]);
	}

	public void testProfileTrimDomainLimits() throws Exception {
		HitBuilder builder = new ProfileTrimHitBuilder();
		// Trailing hit residues opposite query gaps
		Hit hit = builder.buildHit("MKVL--A", "h/1-6", "MKVLWW-");
		assertEquals(1, hit.getIfir());
		assertEquals(4, hit.getIlas());
		assertEquals(1, hit.getJfir());
		assertEquals(6, hit.getJlas());
		assertEquals(4, hit.getLali());
		assertEquals(6, hit.getLseq2());
		assertEquals("MKVL   ", hit.getAlignedResidues());
		assertEquals(0, hit.getInsertions().size());

		// Leading hit residues opposite query gaps
		hit = builder.buildHit("M--KVL", "h/1-5", "-WWKVL");
		assertEquals(2, hit.getIfir());
		assertEquals(4, hit.getIlas());
		assertEquals(1, hit.getJfir());
		assertEquals(5, hit.getJlas());
		assertEquals(3, hit.getLali());
		assertEquals(5, hit.getLseq2());
		assertEquals("   KVL", hit.getAlignedResidues());

		try {
			builder.buildHit("MKVL", "h/7-3", "MKVL");
			fail("Domain ending before its start should not be accepted");
		} catch (AlignmentFormatException e) {
			// Expected
		}
	}

	public void testScoreTrim() throws Exception {
		Hit hit = new ScoreTrimHitBuilder().buildHit("MKVLAGIV", "hit3", "WKVLAGID");
		assertEquals(2, hit.getIfir());
		assertEquals(7, hit.getIlas());
		assertEquals(2, hit.getJfir());
		assertEquals(7, hit.getJlas());
		assertEquals(6, hit.getLali());
		assertEquals(6, hit.getIdenticalCount());
		assertEquals(8, hit.getLseq2());
		assertEquals(" KVLAGI ", hit.getAlignedResidues());
	}

	public void testSimilarity() throws Exception {
		Hit hit = new ScoreTrimHitBuilder().buildHit("MKVLAGIVLA", "hit4", "MRVIAGLVLS");
		assertEquals(10, hit.getLali());
		assertEquals(6, hit.getIdenticalCount());
		assertEquals(10, hit.getSimilarCount());
		assertEquals(0.6, hit.getIde(), 0.0001);
		assertEquals(1.0, hit.getWsim(), 0.0001);
		assertTrue(hit.getIdenticalCount()<=hit.getSimilarCount());
		assertTrue(hit.getSimilarCount()<=hit.getLali());
		assertTrue(hit.getWsim()>=hit.getIde());
	}

	public void testNoAlignedPairs() throws Exception {
		Hit hit = new ScoreTrimHitBuilder().buildHit("MMM", "hit5", "WWW");
		assertEquals(0, hit.getLali());
		assertEquals(0.0, hit.getIde(), 0.0001);
		assertFalse(hit.isSignificant());
	}

	public void testInvalidRows() throws Exception {
		HitBuilder builder = new ScoreTrimHitBuilder();
		assertInvalid(builder, "-MKV", "AMKV");
		assertInvalid(builder, "MKV-", "MKVA");
		assertInvalid(builder, "MKVL", "MKV");
		assertInvalid(builder, "", "");
	}

	public void testBuildHits() throws Exception {
		List<AlignedSequence> seqs = new ArrayList<AlignedSequence>();
		seqs.add(new AlignedSequence("query", "MKTAYIAKQRQISFVKSHFS"));
		AlignedSequence s1 = new AlignedSequence("good/1-20", "MKTAYIAKQRQISFVKSHFS");
		s1.setDescription("Good hit");
		seqs.add(s1);
		seqs.add(new AlignedSequence("bad/1-20", "MKWWWWWWWWWWWWWWWWFS"));
		HitBuilder builder = HitBuilder.getInstance("profile");
		List<Hit> hits = builder.buildHits(new SequenceAlignment(seqs), 'A');
		assertEquals(1, hits.size());
		Hit hit = hits.get(0);
		assertEquals("good", hit.getId());
		assertEquals("Good hit", hit.getDescription());
		assertEquals('A', hit.getChainId());
		assertEquals(1, hit.getSourceAlignmentIndex());
	}

	public void testUnknownPolicy() {
		try {
			HitBuilder.getInstance("global");
			fail("Unknown policy should not be accepted");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}

	public void testRankHits() {
		List<Hit> hits = new ArrayList<Hit>();
		for(int i=0;i<10050;i++) {
			Hit hit = new Hit("h"+i);
			hit.setIde((i%100)/100.0);
			hit.setLali(20+i%7);
			hits.add(hit);
		}
		HitBuilder.rankHits(hits, 9999);
		assertEquals(9999, hits.size());
		for(int i=0;i<hits.size();i++) {
			assertEquals(i+1, hits.get(i).getRank());
			if(i>0) {
				Hit prev = hits.get(i-1);
				Hit hit = hits.get(i);
				assertTrue(prev.getIde()>=hit.getIde());
				if(prev.getIde()==hit.getIde()) assertTrue(prev.getLali()>=hit.getLali());
			}
		}
		assertEquals(0.99, hits.get(0).getIde(), 0.0001);
	}

	private static void assertInvalid(HitBuilder builder, String query, String row) throws AlignmentFormatException {
		try {
			builder.buildHit(query, "hit", row);
			fail("Alignment of "+row+" to "+query+" should not be accepted");
		} catch (InvalidAlignmentException e) {
			// Expected
		}
	}
}
