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

import java.util.Objects;

import htsjdk.samtools.util.Locatable;

/**
 * A marker of a VBI index: a point interval (chrom,pos,pos) and its ordinal in the source
 * @author Pierre Lindenbaum
 */
public final class IndexedLocus implements Locatable {
	private final String contig;
	private final long position;
	private final int ordinal;

	public IndexedLocus(final String contig,final long position,final int ordinal) {
		this.contig = Objects.requireNonNull(contig);
		this.position = position;
		this.ordinal = ordinal;
		}

	@Override
	public String getContig() {
		return this.contig;
		}

	/** 1-based position */
	public long getPosition() {
		return this.position;
		}

	@Override
	public int getStart() {
		return (int)Math.min(Integer.MAX_VALUE, this.position);
		}

	@Override
	public int getEnd() {
		return getStart();
		}

	/** 0-based index of the record in the source */
	public int getOrdinal() {
		return this.ordinal;
		}

	@Override
	public int hashCode() {
		return Objects.hash(this.contig, this.position, this.ordinal);
		}

	@Override
	public boolean equals(final Object obj) {
		if(obj==this) return true;
		if(obj==null || !(obj instanceof IndexedLocus)) return false;
		final IndexedLocus o = IndexedLocus.class.cast(obj);
		return this.ordinal==o.ordinal && this.position==o.position && this.contig.equals(o.contig);
		}

	@Override
	public String toString() {
		return this.contig+":"+this.position+"-"+this.position+" #"+this.ordinal;
		}
}
