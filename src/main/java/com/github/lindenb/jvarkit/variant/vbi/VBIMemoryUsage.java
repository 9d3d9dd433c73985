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

/**
 * Estimated memory used by a loaded {@link VBIIndex}
 */
public final class VBIMemoryUsage {
	private final long indexBytes;
	private final long intervalIndexBytes;

	public VBIMemoryUsage(final long indexBytes,final long intervalIndexBytes) {
		this.indexBytes = indexBytes;
		this.intervalIndexBytes = intervalIndexBytes;
		}

	/** @return bytes used by the arrays and the chromosome dictionary */
	public long getIndexBytes() {
		return this.indexBytes;
		}

	/** @return bytes used by the interval index */
	public long getIntervalIndexBytes() {
		return this.intervalIndexBytes;
		}

	public long getTotalBytes() {
		return this.indexBytes + this.intervalIndexBytes;
		}

	@Override
	public String toString() {
		return "index_bytes="+this.indexBytes+" interval_index_bytes="+this.intervalIndexBytes;
		}
}
