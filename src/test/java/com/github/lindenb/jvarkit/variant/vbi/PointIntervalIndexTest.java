package com.github.lindenb.jvarkit.variant.vbi;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class PointIntervalIndexTest {

	private static class Interval {
		final String contig;
		final long start;
		final long end;
		final int payload;
		Interval(String contig,long start,long end,int payload) {
			this.contig = contig;
			this.start = start;
			this.end = end;
			this.payload = payload;
			}
		}

	@DataProvider(name = "sizes")
	public Object[][] createSizes() {
		return new Object[][] {{0},{1},{2},{3},{7},{8},{15},{16},{17},{31},{33},{100},{1000},{5000}};
		}

	@Test(dataProvider = "sizes")
	public void compareWithBruteForce(final int n) {
		final Random rnd = new Random(n);
		final String[] contigs = new String[] {"chr1","chr2","chr3"};
		final List<Interval> intervals = new ArrayList<>(n);
		final PointIntervalIndex index = new PointIntervalIndex();
		for(int i=0;i< n;i++) {
			final String contig = contigs[rnd.nextInt(contigs.length)];
			final long start = 1 + rnd.nextInt(10_000);
			final long end = rnd.nextInt(4)==0 ? start + rnd.nextInt(500) : start;
			intervals.add(new Interval(contig, start, end, i));
			index.add(contig, start, end, i);
			}
		Assert.assertEquals(index.getState(), PointIntervalIndex.State.BUILDING);
		index.finalizeIndex();
		Assert.assertEquals(index.getState(), PointIntervalIndex.State.FINALIZED);
		Assert.assertEquals(index.size(), n);

		for(int q=0;q< 300;q++) {
			final String contig = contigs[rnd.nextInt(contigs.length)];
			final long start = rnd.nextInt(10_600);
			final long end = start + (q%10==0 ? 0 : rnd.nextInt(2_000));
			final List<Integer> expect = new ArrayList<>();
			for(final Interval r: intervals) {
				if(r.contig.equals(contig) && r.start <= end && start <= r.end) expect.add(r.payload);
				}
			final List<Integer> found = VariantFixtures.toSortedSet(index.overlap(contig, start, end));
			Assert.assertEquals(found, expect, "query "+contig+":"+start+"-"+end);
			Assert.assertEquals(index.overlap(contig, start, end).length, expect.size());
			}
		}

	@Test
	public void boundsAreIncluded() {
		final PointIntervalIndex index = new PointIntervalIndex();
		index.addPoint("chr1", 100L, 0);
		index.addPoint("chr1", 200L, 1);
		index.add("chr1", 150L, 160L, 2);
		index.finalizeIndex();
		Assert.assertEquals(index.overlap("chr1", 100L, 100L), new int[] {0});
		Assert.assertEquals(index.overlap("chr1", 99L, 99L), new int[0]);
		Assert.assertEquals(index.overlap("chr1", 160L, 200L), new int[] {2, 1});
		Assert.assertEquals(index.overlap("chr1", 161L, 199L), new int[0]);
		Assert.assertEquals(index.overlap("chr1", 0L, Long.MAX_VALUE).length, 3);
		}

	@Test
	public void unknownContigOrInvertedRange() {
		final PointIntervalIndex index = new PointIntervalIndex();
		index.addPoint("chr1", 100L, 0);
		index.finalizeIndex();
		Assert.assertEquals(index.overlap("chr2", 0L, 1000L).length, 0);
		Assert.assertEquals(index.overlap("chr1", 200L, 50L).length, 0);
		}

	@Test
	public void samePositionManyTimes() {
		final PointIntervalIndex index = new PointIntervalIndex();
		for(int i=0;i< 50;i++) index.addPoint("chr1", 42L, 49 - i);
		index.finalizeIndex();
		final int[] hits = index.overlap("chr1", 42L, 42L);
		Assert.assertEquals(hits.length, 50);
		for(int i=0;i< hits.length;i++) Assert.assertEquals(hits[i], i);
		}

	@Test(expectedExceptions = IllegalStateException.class)
	public void queryBeforeFinalize() {
		final PointIntervalIndex index = new PointIntervalIndex();
		index.addPoint("chr1", 100L, 0);
		index.overlap("chr1", 1L, 1000L);
		}

	@Test(expectedExceptions = IllegalStateException.class)
	public void insertAfterFinalize() {
		final PointIntervalIndex index = new PointIntervalIndex();
		index.addPoint("chr1", 100L, 0);
		index.finalizeIndex();
		index.addPoint("chr1", 200L, 1);
		}

	@Test(expectedExceptions = IllegalStateException.class)
	public void finalizeTwice() {
		final PointIntervalIndex index = new PointIntervalIndex();
		index.finalizeIndex();
		index.finalizeIndex();
		}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectEndBeforeStart() {
		new PointIntervalIndex().add("chr1", 10L, 9L, 0);
		}

	@Test
	public void memoryUsage() {
		final PointIntervalIndex index = new PointIntervalIndex();
		for(int i=0;i< 100;i++) index.addPoint("chr1", i+1, i);
		index.finalizeIndex();
		Assert.assertTrue(index.estimateMemoryUsage() >= 100L * 28L);
		}
}
