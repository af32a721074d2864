package hssp.alignments.test;

import hssp.alignments.HomologyThreshold;
import junit.framework.TestCase;

public class HomologyThresholdTest extends TestCase {
	public void testTable() {
		double last = 1;
		for(int l=HomologyThreshold.MIN_LENGTH;l<=HomologyThreshold.MAX_LENGTH;l++) {
			double t = HomologyThreshold.getThreshold(l);
			assertTrue("Threshold increases at length "+l, t<=last);
			assertEquals("Closed form differs at length "+l, HomologyThreshold.calculateThreshold(l), t, 0.0001);
			last = t;
		}
		assertEquals(0.845468, HomologyThreshold.getThreshold(10), 0.000001);
		assertEquals(0.297221, HomologyThreshold.getThreshold(80), 0.000001);
	}
	public void testClamp() {
		assertEquals(HomologyThreshold.getThreshold(10), HomologyThreshold.getThreshold(1), 0.000001);
		assertEquals(HomologyThreshold.getThreshold(10), HomologyThreshold.getThreshold(0), 0.000001);
		assertEquals(HomologyThreshold.getThreshold(80), HomologyThreshold.getThreshold(500), 0.000001);
		assertEquals(0, HomologyThreshold.getTableIndex(3));
		assertEquals(70, HomologyThreshold.getTableIndex(1000));
	}
	public void testIsHomologous() {
		assertTrue(HomologyThreshold.isHomologous(1.0, 5));
		assertTrue(HomologyThreshold.isHomologous(0.5, 100));
		assertFalse(HomologyThreshold.isHomologous(0.25, 100));
		double t = HomologyThreshold.getThreshold(30);
		assertFalse(HomologyThreshold.isHomologous(t, 30));
		assertTrue(HomologyThreshold.isHomologous(t+0.001, 30));
	}
}
