/*
The MIT License (MIT)

Copyright (c) 2025 Pierre Lindenbaum

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.


*/
package com.github.lindenb.jvarkit.variant.vbi;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.github.lindenb.jvarkit.variant.vbi.io.SourceCodec;

import htsjdk.samtools.util.Log;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * A loaded VBI index. Once loaded, the index is read-only and can be queried
 * by concurrent callers. {@link #close()} releases the whole index, any later
 * call throws an {@link IllegalStateException}.
 *
 * <pre>
 * try(VBIIndex idx = VBIIndex.load(Paths.get("in.vcf.gz.vbi"))) {
 *	int[] ordinals = idx.queryRegionIndexed("chr1:100-200,chr2");
 *	}
 * </pre>
 * @author Pierre Lindenbaum
 */
public class VBIIndex implements Closeable {
	private static final Log LOG=Log.getInstance(VBIIndex.class);

	/** everything owned by the index, released at once in {@link #close()} */
	private static class Data {
		final VBIIndexCodec.Content content;
		final Object2IntOpenHashMap<String> chrom2id = new Object2IntOpenHashMap<>();
		final PointIntervalIndex intervals = new PointIntervalIndex();
		Data(final VBIIndexCodec.Content content) {
			this.content = content;
			this.chrom2id.defaultReturnValue(-1);
			final List<String> chroms = content.getChromosomes();
			for(int i=0;i< chroms.size();i++) {
				this.chrom2id.put(chroms.get(i), i);
				}
			for(int i=0;i< content.getMarkerCount();i++) {
				this.intervals.addPoint(chroms.get(content.getChromId(i)), content.getPosition(i), i);
				}
			this.intervals.finalizeIndex();
			}
		}

	private volatile Data data;

	/** create an index from a decoded content */
	public VBIIndex(final VBIIndexCodec.Content content) {
		this.data = new Data(content);
		}

	/**
	 * load an index from a file
	 * @param path the index
	 * @return the loaded index
	 * @throws VBIFormatException if the file is truncated or malformed
	 * @throws IOException if the file cannot be read
	 */
	public static VBIIndex load(final Path path) throws IOException {
		final VBIIndexCodec.Content content;
		try(InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
			content = VBIIndexCodec.decode(in);
			}
		catch(final VBIFormatException err) {
			throw new VBIFormatException(path+" : "+err.getMessage(), err);
			}
		LOG.debug("loaded "+path+" : "+content.getMarkerCount()+" markers");
		return new VBIIndex(content);
		}

	private Data getData() {
		final Data d = this.data;
		if(d==null) throw new IllegalStateException("VBI index was closed");
		return d;
		}

	public long getSampleCount() {
		return getData().content.getSampleCount();
		}

	/** @return the number of indexed records */
	public int getMarkerCount() {
		return getData().content.getMarkerCount();
		}

	/** @return the chromosomes, in the order they were first seen */
	public List<String> getChromosomes() {
		return getData().content.getChromosomes();
		}

	/** @return the chromosome of the ordinal-th record */
	public String getContig(final int ordinal) {
		final Data d = getData();
		return d.content.getChromosomes().get(d.content.getChromId(ordinal));
		}

	/** @return the 1-based position of the ordinal-th record */
	public long getPosition(final int ordinal) {
		return getData().content.getPosition(ordinal);
		}

	/** @return the seek token of the ordinal-th record */
	public long getOffset(final int ordinal) {
		return getData().content.getOffset(ordinal);
		}

	/** @return the seek tokens of the given ordinals */
	public long[] getOffsets(final int[] ordinals) {
		final VBIIndexCodec.Content content = getData().content;
		final long[] array = new long[ordinals.length];
		for(int i=0;i< ordinals.length;i++) {
			array[i] = content.getOffset(ordinals[i]);
			}
		return array;
		}

	/**
	 * find the records in the regions with a scan of all the markers
	 * @param regions comma-separated regions, see {@link RegionParser}
	 * @return the ordinals, sorted, without duplicates
	 * @throws VBIRegionException if the regions cannot be parsed
	 */
	public int[] queryRegion(final String regions) {
		return queryRegion(RegionParser.parseRegions(regions));
		}

	/** find the records in the regions with a scan of all the markers */
	public int[] queryRegion(final List<Region> regions) {
		final Data d = getData();
		final int n = d.content.getMarkerCount();
		final VBIIndexCodec.Content content = d.content;
		// resolve the chromosomes once, unknown chromosomes are ignored
		final List<Region> known = new ArrayList<>(regions.size());
		final IntArrayList knownIds = new IntArrayList(regions.size());
		for(final Region r: regions) {
			final int tid = d.chrom2id.getInt(r.getContig());
			if(tid==-1) continue;
			known.add(r);
			knownIds.add(tid);
			}
		final IntArrayList hits = new IntArrayList();
		if(known.isEmpty()) return hits.toIntArray();
		for(int i=0;i< n;i++) {
			for(int j=0;j< known.size();j++) {
				final Region r = known.get(j);
				if(content.getChromId(i)==knownIds.getInt(j) &&
					r.getStartLong() <= content.getPosition(i) &&
					content.getPosition(i) <= r.getEndLong()) {
					hits.add(i);
					break;
					}
				}
			}
		return hits.toIntArray();
		}

	/**
	 * find the records in the regions using the interval index.
	 * The ordinals found for each region are sorted and appended in the order of the regions,
	 * so an ordinal matched by two regions is reported twice.
	 * @param regions comma-separated regions, see {@link RegionParser}
	 * @return the ordinals
	 * @throws VBIRegionException if the regions cannot be parsed
	 */
	public int[] queryRegionIndexed(final String regions) {
		return queryRegionIndexed(RegionParser.parseRegions(regions));
		}

	/** find the records in the regions using the interval index. */
	public int[] queryRegionIndexed(final List<Region> regions) {
		final Data d = getData();
		final IntArrayList hits = new IntArrayList();
		for(final Region r: regions) {
			final int[] array = d.intervals.overlap(r.getContig(), r.getStartLong(), r.getEndLong());
			Arrays.sort(array);
			hits.addElements(hits.size(), array);
			}
		return hits.toIntArray();
		}

	/**
	 * get the ordinals of the records between two 1-based indexes, bounds included.
	 * The bounds are clamped to [1,N].
	 * @return the 0-based ordinals, or an empty array if the range is empty
	 */
	public int[] queryIndexRange(final long start1,final long end1) {
		final int n = getMarkerCount();
		final long start = Math.max(1L, start1);
		final long end = Math.min((long)n, end1);
		if(start > end) return new int[0];
		final int[] array = new int[(int)(end - start + 1L)];
		for(int i=0;i< array.length;i++) {
			array[i] = (int)(start - 1L) + i;
			}
		return array;
		}

	/**
	 * @param limit max number of items, all the markers if limit&lt;=0
	 * @return the markers, in the order of the source
	 */
	public List<IndexedLocus> extractRanges(final int limit) {
		final Data d = getData();
		final int n = (limit <= 0 ? d.content.getMarkerCount() : Math.min(limit, d.content.getMarkerCount()));
		final List<IndexedLocus> L = new ArrayList<>(n);
		final List<String> chroms = d.content.getChromosomes();
		for(int i=0;i< n;i++) {
			L.add(new IndexedLocus(chroms.get(d.content.getChromId(i)), d.content.getPosition(i), i));
			}
		return L;
		}

	/** @return all the markers, in the order of the source */
	public List<IndexedLocus> extractRanges() {
		return extractRanges(0);
		}

	/** @return the estimated memory used by this index */
	public VBIMemoryUsage memoryUsage() {
		final Data d = getData();
		long n = (long)d.content.getMarkerCount() * (Integer.BYTES + Long.BYTES + Long.BYTES);
		for(final String s: d.content.getChromosomes()) {
			n += s.length() * 2L + Integer.BYTES * 2;
			}
		return new VBIMemoryUsage(n, d.intervals.estimateMemoryUsage());
		}

	/** print the first markers, with the raw offsets */
	public void print(final PrintStream out,final int n) {
		print(out, n, null);
		}

	/**
	 * print the first markers
	 * @param out where to print
	 * @param n number of markers, all if n&lt;=0
	 * @param codec used to describe the offsets. Can be null
	 */
	public void print(final PrintStream out,final int n,final SourceCodec codec) {
		final Data d = getData();
		out.println("#samples\t"+d.content.getSampleCount());
		out.println("#markers\t"+d.content.getMarkerCount());
		out.println("#chromosomes\t"+String.join(",", d.content.getChromosomes()));
		out.println("#ordinal\tchrom\tpos\toffset"+(codec==null?"":"\t"+codec.name().toLowerCase()));
		for(final IndexedLocus loc: extractRanges(n)) {
			final long offset = d.content.getOffset(loc.getOrdinal());
			out.print(loc.getOrdinal());
			out.print('\t');
			out.print(loc.getContig());
			out.print('\t');
			out.print(loc.getPosition());
			out.print('\t');
			out.print(offset);
			if(codec!=null) {
				out.print('\t');
				out.print(codec.describe(offset));
				}
			out.println();
			}
		out.flush();
		}

	/** @return true if {@link #close()} was called */
	public boolean isClosed() {
		return this.data==null;
		}

	@Override
	public void close() {
		this.data = null;
		}

	@Override
	public String toString() {
		final Data d = this.data;
		if(d==null) return "VBIIndex(closed)";
		return "VBIIndex(samples:"+d.content.getSampleCount()+", markers:"+d.content.getMarkerCount()+", chromosomes:"+d.content.getChromosomes().size()+")";
		}
}
