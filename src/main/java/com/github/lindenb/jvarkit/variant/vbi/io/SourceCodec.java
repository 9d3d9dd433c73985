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
package com.github.lindenb.jvarkit.variant.vbi.io;

import htsjdk.samtools.util.BlockCompressedFilePointerUtil;

/**
 * How the seek tokens of a {@link VariantSource} must be understood.
 * @author Pierre Lindenbaum
 */
public enum SourceCodec {
	/** block-compressed stream, tokens are virtual file offsets (block address &lt;&lt; 16 | offset in block) */
	BGZF,
	/** uncompressed stream, tokens are plain byte offsets */
	PLAIN;

	/** @return a human readable representation of a seek token */
	public String describe(final long offset) {
		switch(this) {
			case BGZF: return String.valueOf(BlockCompressedFilePointerUtil.getBlockAddress(offset))+
					":"+BlockCompressedFilePointerUtil.getBlockOffset(offset);
			default: return String.valueOf(offset);
			}
		}
}
