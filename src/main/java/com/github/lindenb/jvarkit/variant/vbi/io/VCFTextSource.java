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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import htsjdk.samtools.util.Log;
import htsjdk.tribble.TribbleException;
import htsjdk.tribble.readers.LineIterator;
import htsjdk.tribble.readers.LineIteratorImpl;
import htsjdk.tribble.readers.SynchronousLineReader;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFCodec;
import htsjdk.variant.vcf.VCFHeader;

/**
 * {@link VariantSource} for VCF text, either plain or BGZF-compressed
 * @author Pierre Lindenbaum
 */
class VCFTextSource implements VariantSource {
	private static final Log LOG=Log.getInstance(VCFTextSource.class);
	private final Path path;
	private final PositionalInput input;
	private final VCFCodec codec = new VCFCodec();
	private final VCFHeader header;

	VCFTextSource(final Path path,final PositionalInput input) throws IOException {
		this.path = path;
		this.input = input;
		final StringBuilder sb = new StringBuilder();
		for(;;) {
			final String line = input.readLine();
			if(line==null || !line.startsWith("#")) {
				throw new IOException("Cannot find the #CHROM header line in "+path);
				}
			sb.append(line).append('\n');
			if(line.startsWith("#CHROM")) break;
			}
		final byte[] headerBytes = sb.toString().getBytes(StandardCharsets.UTF_8);
		try {
			final LineIterator lr = new LineIteratorImpl(new SynchronousLineReader(new ByteArrayInputStream(headerBytes)));
			this.header = (VCFHeader)this.codec.readActualHeader(lr);
			}
		catch(final TribbleException err) {
			throw new IOException("Cannot decode VCF header of "+path, err);
			}
		LOG.debug("header of "+path+" ends at "+input.getCodec().describe(input.getPosition()));
		}

	@Override
	public Path getPath() {
		return this.path;
		}

	@Override
	public VCFHeader getHeader() {
		return this.header;
		}

	@Override
	public SourceCodec getCodec() {
		return this.input.getCodec();
		}

	@Override
	public long getPosition() throws IOException {
		return this.input.getPosition();
		}

	@Override
	public void seek(long offset) throws IOException {
		this.input.seek(offset);
		}

	@Override
	public VariantContext next() throws IOException {
		for(;;) {
			final String line = this.input.readLine();
			if(line==null) return null;
			if(line.isEmpty()) continue;
			if(line.startsWith("#")) {
				throw new IOException("unexpected header line in the body of "+this.path+" : "+line);
				}
			try {
				return this.codec.decode(line);
				}
			catch(final TribbleException err) {
				throw new IOException("Cannot decode VCF line in "+this.path+" : "+line, err);
				}
			}
		}

	@Override
	public void close() throws IOException {
		this.input.close();
		}
}
