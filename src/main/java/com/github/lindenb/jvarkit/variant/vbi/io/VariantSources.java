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

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import htsjdk.samtools.seekablestream.ISeekableStreamFactory;
import htsjdk.samtools.seekablestream.SeekableStream;
import htsjdk.samtools.seekablestream.SeekableStreamFactory;
import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.Log;

/**
 * Opens a {@link VariantSource} for a VCF, a VCF.GZ or a BCF file.
 *
 * The codec is guessed from the content of the file, not from its name:
 * <ul>
 * <li>BGZF data: seek tokens are virtual offsets</li>
 * <li>uncompressed data: seek tokens are byte offsets</li>
 * <li>gzip data that is not BGZF cannot be indexed and is rejected</li>
 * </ul>
 * @author Pierre Lindenbaum
 */
public class VariantSources {
	private static final Log LOG=Log.getInstance(VariantSources.class);

	private VariantSources() {
		}

	/**
	 * open a new source
	 * @param path the VCF or BCF file
	 * @param threads decompression threads hint, does not change the records or their order
	 * @return the new source, positioned on the first record
	 * @throws IOException if the file cannot be opened or its header cannot be read
	 */
	public static VariantSource open(final Path path,final int threads) throws IOException {
		if(path==null) throw new IllegalArgumentException("path is null");
		if(!Files.isRegularFile(path)) throw new FileNotFoundException("not a file: "+path);
		if(!Files.isReadable(path)) throw new IOException("cannot read "+path);

		final boolean bgzf;
		try(InputStream in=new BufferedInputStream(Files.newInputStream(path))) {
			bgzf = BlockCompressedInputStream.isValidFile(in);
			if(!bgzf && isGzip(in)) {
				throw new IOException(path+" is gzip-compressed but not BGZF-compressed, records cannot be seeked. Use bgzip.");
				}
			}

		final ISeekableStreamFactory ssf = SeekableStreamFactory.getInstance();
		SeekableStream ss = ssf.getStreamFor(path.toString());
		ss = ssf.getBufferedStream(ss);
		final PositionalInput input = bgzf ? PositionalInput.bgzf(ss, threads) : PositionalInput.plain(ss);
		try {
			final long start = input.getPosition();
			final byte[] magic = new byte[BCFSource.MAGIC_HEADER_START.length];
			final int nRead = input.readNBytes(magic, 0, magic.length);
			input.seek(start);
			final VariantSource source;
			if(nRead==magic.length && Arrays.equals(magic, BCFSource.MAGIC_HEADER_START)) {
				source = new BCFSource(path, input);
				}
			else
				{
				source = new VCFTextSource(path, input);
				}
			LOG.debug("opened "+path+" as "+source.getClass().getSimpleName()+" ("+input.getCodec()+")");
			return source;
			}
		catch(final IOException|RuntimeException err) {
			input.close();
			throw err;
			}
		}

	private static boolean isGzip(final InputStream in) throws IOException {
		in.mark(2);
		final int b1 = in.read();
		final int b2 = in.read();
		in.reset();
		return b1==0x1f && b2==0x8b;
		}
}
