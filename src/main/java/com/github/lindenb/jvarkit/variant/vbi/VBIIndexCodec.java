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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import htsjdk.samtools.util.BinaryCodec;
import htsjdk.samtools.util.RuntimeEOFException;
import htsjdk.samtools.util.RuntimeIOException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;

/**
 * Reads and writes the binary layout of a VBI index. All values are little-endian.
 * <pre>
 * magic          4 bytes  'V' 'B' 'I' 1
 * version        int32
 * sample_count   int64
 * marker_count   int64    N
 * chrom_count    int32    C
 * C x { name_len int32 ; name UTF-8, no trailing NUL }
 * N x { chrom_id int32 ; position int64 ; offset int64 }
 * </pre>
 * @author Pierre Lindenbaum
 */
public class VBIIndexCodec {
	/** first bytes of a VBI index */
	public static final byte[] MAGIC = new byte[] {'V','B','I',1};
	/** current version of the layout */
	public static final int VERSION = 1;
	/** largest chromosome name we accept when reading */
	static final int MAX_NAME_LENGTH = 1 << 16;
	/** arrays are indexed with an int */
	static final long MAX_MARKERS = Integer.MAX_VALUE - 8L;
	/* avoid huge allocations on a corrupted marker count */
	private static final int MAX_INITIAL_CAPACITY = 1 << 20;

	/** the decoded content of a VBI file */
	public static class Content {
		private final long sampleCount;
		private final List<String> chromosomes;
		private final int[] chromIds;
		private final long[] positions;
		private final long[] offsets;

		/**
		 * the arrays are copied
		 * @throws IllegalArgumentException if the arrays have different lengths or a chromosome id is out of range
		 */
		public Content(final long sampleCount, final List<String> chromosomes, final int[] chromIds, final long[] positions, final long[] offsets) {
			this(sampleCount, chromosomes, chromIds.clone(), positions.clone(), offsets.clone(), true);
			}

		private Content(final long sampleCount, final List<String> chromosomes, final int[] chromIds, final long[] positions, final long[] offsets, final boolean validate) {
			if(chromIds.length!=positions.length || chromIds.length!=offsets.length) {
				throw new IllegalArgumentException("arrays must have the same length");
				}
			this.sampleCount = sampleCount;
			this.chromosomes = Collections.unmodifiableList(new ArrayList<>(chromosomes));
			if(validate) {
				for(int i=0;i< chromIds.length;i++) {
					if(chromIds[i] < 0 || chromIds[i] >= this.chromosomes.size()) {
						throw new IllegalArgumentException("marker #"+(i+1)+" has a bad chromosome id "+chromIds[i]+" (chromosome count: "+this.chromosomes.size()+")");
						}
					}
				}
			this.chromIds = chromIds;
			this.positions = positions;
			this.offsets = offsets;
			}
		public long getSampleCount() {
			return this.sampleCount;
			}
		public List<String> getChromosomes() {
			return this.chromosomes;
			}
		/** @return a copy of the chromosome ids */
		public int[] getChromIds() {
			return this.chromIds.clone();
			}
		/** @return a copy of the positions */
		public long[] getPositions() {
			return this.positions.clone();
			}
		/** @return a copy of the offsets */
		public long[] getOffsets() {
			return this.offsets.clone();
			}
		int getChromId(final int ordinal) {
			return this.chromIds[ordinal];
			}
		long getPosition(final int ordinal) {
			return this.positions[ordinal];
			}
		long getOffset(final int ordinal) {
			return this.offsets[ordinal];
			}
		public int getMarkerCount() {
			return this.chromIds.length;
			}
		}

	private VBIIndexCodec() {
		}

	/**
	 * write the index. The stream is flushed, not closed.
	 */
	public static void encode(final OutputStream out,final Content content) throws IOException {
		final BinaryCodec bc = new BinaryCodec(out);
		try {
			bc.writeBytes(MAGIC);
			bc.writeInt(VERSION);
			bc.writeLong(content.getSampleCount());
			bc.writeLong(content.getMarkerCount());
			bc.writeInt(content.getChromosomes().size());
			for(final String chrom: content.getChromosomes()) {
				final byte[] name = chrom.getBytes(StandardCharsets.UTF_8);
				bc.writeInt(name.length);
				bc.writeBytes(name);
				}
			for(int i=0;i< content.getMarkerCount();i++) {
				bc.writeInt(content.getChromId(i));
				bc.writeLong(content.getPosition(i));
				bc.writeLong(content.getOffset(i));
				}
			out.flush();
			}
		catch(final RuntimeIOException err) {
			throw unwrap(err);
			}
		}

	/**
	 * read an index
	 * @param in the stream, not closed
	 * @return the content
	 * @throws VBIFormatException if the data is truncated or malformed
	 */
	public static Content decode(final InputStream in) throws IOException {
		final BinaryCodec bc = new BinaryCodec(in);
		try {
			final byte[] magic = new byte[MAGIC.length];
			bc.readBytes(magic);
			if(!Arrays.equals(magic, MAGIC)) {
				throw new VBIFormatException("not a VBI index: bad magic "+Arrays.toString(magic));
				}
			final int version = bc.readInt();
			if(version!=VERSION) {
				throw new VBIFormatException("unsupported VBI version "+version+" (expected "+VERSION+")");
				}
			final long sampleCount = bc.readLong();
			if(sampleCount < 0L) throw new VBIFormatException("negative sample count "+sampleCount);
			final long markerCount = bc.readLong();
			if(markerCount < 0L) throw new VBIFormatException("negative marker count "+markerCount);
			if(markerCount > MAX_MARKERS) throw new VBIFormatException("too many markers "+markerCount);
			final int chromCount = bc.readInt();
			if(chromCount < 0) throw new VBIFormatException("negative chromosome count "+chromCount);
			if(chromCount > markerCount) throw new VBIFormatException("more chromosomes ("+chromCount+") than markers ("+markerCount+")");

			final List<String> chromosomes = new ArrayList<>(chromCount);
			for(int i=0;i< chromCount;i++) {
				final int len = bc.readInt();
				if(len < 0 || len > MAX_NAME_LENGTH) throw new VBIFormatException("bad length for chromosome name #"+(i+1)+" : "+len);
				final byte[] name = new byte[len];
				bc.readBytes(name);
				chromosomes.add(new String(name, StandardCharsets.UTF_8));
				}

			final int n = (int)markerCount;
			final int capacity = Math.min(n, MAX_INITIAL_CAPACITY);
			final IntArrayList chromIds = new IntArrayList(capacity);
			final LongArrayList positions = new LongArrayList(capacity);
			final LongArrayList offsets = new LongArrayList(capacity);
			for(int i=0;i< n;i++) {
				final int tid = bc.readInt();
				if(tid < 0 || tid >= chromCount) {
					throw new VBIFormatException("marker #"+(i+1)+" has a bad chromosome id "+tid+" (chromosome count: "+chromCount+")");
					}
				chromIds.add(tid);
				positions.add(bc.readLong());
				offsets.add(bc.readLong());
				}
			// ids were checked while reading
			return new Content(sampleCount, chromosomes, chromIds.toIntArray(), positions.toLongArray(), offsets.toLongArray(), false);
			}
		catch(final RuntimeEOFException err) {
			throw new VBIFormatException("truncated VBI index", err);
			}
		catch(final RuntimeIOException err) {
			throw unwrap(err);
			}
		}

	private static IOException unwrap(final RuntimeIOException err) {
		if(err.getCause() instanceof IOException) return IOException.class.cast(err.getCause());
		return new IOException(err);
		}
}
