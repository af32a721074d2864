package hssp.clustering.test;

import java.util.Arrays;
import java.util.List;

import hssp.clustering.ContainedSequencesClustering;
import junit.framework.TestCase;

public class ContainedSequencesClusteringTest extends TestCase {

	private static final String LONG = "MKTAYIAKQRQISFVKSHFSRQLEERLGLIEVQAPILSRV";

	public void testContained() {
		ContainedSequencesClustering clustering = new ContainedSequencesClustering();
		List<Integer> reps = clustering.cluster(Arrays.asList(LONG, LONG.substring(5, 25)));
		assertEquals(1, reps.size());
		assertEquals(0, reps.get(0).intValue());
		assertEquals(0, clustering.getRepresentative(1));

		reps = clustering.cluster(Arrays.asList(LONG.substring(5, 25), LONG));
		assertEquals(1, reps.size());
		assertEquals(1, reps.get(0).intValue());
		assertEquals(1, clustering.getRepresentative(0));
	}

	public void testDistinct() {
		ContainedSequencesClustering clustering = new ContainedSequencesClustering();
		List<Integer> reps = clustering.cluster(Arrays.asList("MKTAYIAKQR", "WWWWWWWWWW", "GLIEVQAPIL"));
		assertEquals(Arrays.asList(0, 1, 2), reps);
		int [] r = clustering.getRepresentatives();
		for(int i=0;i<r.length;i++) assertEquals(i, r[i]);
	}

	public void testTransitive() {
		ContainedSequencesClustering clustering = new ContainedSequencesClustering();
		// The first sequence is contained in the second, which is contained in the third
		List<Integer> reps = clustering.cluster(Arrays.asList(LONG.substring(10, 20), LONG.substring(5, 30), LONG, "WWWWWWWW"));
		assertEquals(Arrays.asList(2, 3), reps);
		assertEquals(2, clustering.getRepresentative(0));
		assertEquals(2, clustering.getRepresentative(1));
		assertEquals(2, clustering.getRepresentative(2));
	}

	public void testIdentical() {
		ContainedSequencesClustering clustering = new ContainedSequencesClustering();
		List<Integer> reps = clustering.cluster(Arrays.asList(LONG, LONG));
		assertEquals(Arrays.asList(0), reps);
		assertEquals(0, clustering.getRepresentative(1));
	}

	public void testNotClustered() {
		try {
			new ContainedSequencesClustering().getRepresentative(0);
			fail("Representatives should not be available before clustering");
		} catch (IllegalStateException e) {
			// Expected
		}
	}
}
