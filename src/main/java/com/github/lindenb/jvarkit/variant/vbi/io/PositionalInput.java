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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import htsjdk.samtools.seekablestream.SeekableStream;
import htsjdk.samtools.util.AsyncBlockCompressedInputStream;
import htsjdk.samtools.util.BlockCompressedInputStream;

/**
 * An {@link InputStream} that can tell where it is and go back there.
 * For BGZF data the position is a virtual file offset, otherwise a byte offset.
 * @author Pierre Lindenbaum
 */
public abstract class PositionalInput extends InputStream {

	PositionalInput() {
		}

	/** @return the kind of offset returned by {@link #getPosition()} */
	public abstract SourceCodec getCodec();

	/** @return the current seek token */
	public abstract long getPosition() throws IOException;

	/** move to a seek token previously returned by {@link #getPosition()} */
	public abstract void seek(long offset) throws IOException;

	/** @return the next line without its terminator, or null at end of stream */
	public abstract String readLine() throws IOException;

	/**
	 * open a block compressed input
	 * @param ss the underlying seekable stream
	 * @param threads when greater than 1, blocks are inflated ahead in a background thread
	 * @return the new input
	 */
	public static PositionalInput bgzf(final SeekableStream ss, final int threads) {
		final BlockCompressedInputStream bci = threads > 1 ?
				new AsyncBlockCompressedInputStream(ss) :
				new BlockCompressedInputStream(ss);
		return new BgzfInput(bci);
		}

	/**
	 * open a plain input
	 * @param ss the underlying seekable stream, should be buffered
	 * @return the new input
	 */
	public static PositionalInput plain(final SeekableStream ss) {
		return new PlainInput(ss);
		}

	private static class BgzfInput extends PositionalInput {
		private final BlockCompressedInputStream delegate;
		BgzfInput(final BlockCompressedInputStream delegate) {
			this.delegate = delegate;
			}
		@Override
		public SourceCodec getCodec() {
			return SourceCodec.BGZF;
			}
		@Override
		public long getPosition() {
			return this.delegate.getFilePointer();
			}
		@Override
		public void seek(long offset) throws IOException {
			this.delegate.seek(offset);
			}
		@Override
		public String readLine() throws IOException {
			return this.delegate.readLine();
			}
		@Override
		public int read() throws IOException {
			return this.delegate.read();
			}
		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			return this.delegate.read(b, off, len);
			}
		@Override
		public void close() throws IOException {
			this.delegate.close();
			}
		}

	private static class PlainInput extends PositionalInput {
		private final SeekableStream delegate;
		private final ByteArrayOutputStream line = new ByteArrayOutputStream(1024);
		PlainInput(final SeekableStream delegate) {
			this.delegate = delegate;
			}
		@Override
		public SourceCodec getCodec() {
			return SourceCodec.PLAIN;
			}
		@Override
		public long getPosition() throws IOException {
			return this.delegate.position();
			}
		@Override
		public void seek(long offset) throws IOException {
			if(offset < 0L || offset > this.delegate.length()) {
				throw new IOException("offset "+offset+" is out of range for "+this.delegate.getSource());
				}
			this.delegate.seek(offset);
			}
		@Override
		public String readLine() throws IOException {
			this.line.reset();
			int c = this.delegate.read();
			if(c==-1) return null;
			while(c!=-1 && c!='\n') {
				this.line.write(c);
				c = this.delegate.read();
				}
			int n = this.line.size();
			final byte[] array = this.line.toByteArray();
			if(n>0 && array[n-1]=='\r') n--;
			return new String(array, 0, n, StandardCharsets.UTF_8);
			}
		@Override
		public int read() throws IOException {
			return this.delegate.read();
			}
		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			return this.delegate.read(b, off, len);
			}
		@Override
		public void close() throws IOException {
			this.delegate.close();
			}
		}
}
