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
 * A region parsed by {@link RegionParser}. Coordinates are 1-based, inclusive.
 * A whole chromosome is the range [0, Long.MAX_VALUE].
 * @author Pierre Lindenbaum
 */
public final class Region implements Locatable {
	private final String contig;
	private final long start;
	private final long end;
	private final boolean point;

	public Region(final String contig,final long start,final long end,final boolean point) {
		this.contig = Objects.requireNonNull(contig, "contig is null");
		this.start = start;
		this.end = end;
		this.point = point;
		if(point && start!=end) throw new IllegalArgumentException("a point region must have start==end");
		}

	/** @return a region covering a whole chromosome */
	public static Region ofContig(final String contig) {
		return new Region(contig, 0L, Long.MAX_VALUE, false);
		}

	/** @return a region covering a single position */
	public static Region ofPoint(final String contig,final long pos) {
		return new Region(contig, pos, pos, true);
		}

	@Override
	public String getContig() {
		return this.contig;
		}

	/** @return the start, clipped to the int range of {@link Locatable} */
	@Override
	public int getStart() {
		return (int)Math.min(Integer.MAX_VALUE, Math.max(Integer.MIN_VALUE, this.start));
		}

	/** @return the end, clipped to the int range of {@link Locatable} */
	@Override
	public int getEnd() {
		return (int)Math.min(Integer.MAX_VALUE, Math.max(Integer.MIN_VALUE, this.end));
		}

	public long getStartLong() {
		return this.start;
		}

	public long getEndLong() {
		return this.end;
		}

	/** @return true if a single position was given */
	public boolean isPoint() {
		return this.point;
		}

	/** @return true if this region spans a whole chromosome */
	public boolean isWholeContig() {
		return !this.point && this.start==0L && this.end==Long.MAX_VALUE;
		}

	/** @return true if 'pos' on 'contig' lies in this region */
	public boolean contains(final String contig,final long pos) {
		return this.contig.equals(contig) && this.start <= pos && pos <= this.end;
		}

	@Override
	public int hashCode() {
		return Objects.hash(this.contig, this.start, this.end, this.point);
		}

	@Override
	public boolean equals(final Object obj) {
		if(obj==this) return true;
		if(obj==null || !(obj instanceof Region)) return false;
		final Region o = Region.class.cast(obj);
		return this.contig.equals(o.contig) &&
				this.start==o.start &&
				this.end==o.end &&
				this.point==o.point;
		}

	@Override
	public String toString() {
		if(isWholeContig()) return this.contig;
		if(this.point) return this.contig+":"+this.start;
		return this.contig+":"+this.start+"-"+this.end;
		}
}
