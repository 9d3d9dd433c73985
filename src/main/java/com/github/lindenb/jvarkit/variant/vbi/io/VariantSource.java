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

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFHeader;

/**
 * A streaming reader of VCF or BCF records that can report and restore its position.
 * A source is not thread safe and must not be shared between concurrent callers.
 * Use {@link VariantSources#open(Path, int)} to get an instance.
 *
 * <pre>
 * try(VariantSource src = VariantSources.open(path, 1)) {
 *	long offset = src.getPosition();
 *	VariantContext ctx = src.next();
 *	(...)
 *	src.seek(offset);
 *	}
 * </pre>
 * @author Pierre Lindenbaum
 */
public interface VariantSource extends Closeable {
	/** @return the path of the underlying file */
	public Path getPath();
	/** @return the header, read when the source was opened */
	public VCFHeader getHeader();
	/** @return the kind of seek tokens returned by {@link #getPosition()} */
	public SourceCodec getCodec();
	/** @return the seek token of the next record to be read */
	public long getPosition() throws IOException;
	/** move to a seek token previously returned by {@link #getPosition()} on the same file */
	public void seek(long offset) throws IOException;
	/** @return the next record or null at the end of the stream */
	public VariantContext next() throws IOException;
}
