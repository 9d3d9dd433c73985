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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

public class VBIIndexCodecTest {

	private static VBIIndexCodec.Content createContent() {
		return new VBIIndexCodec.Content(
				3L,
				Arrays.asList("chr1","chré:2"),
				new int[] {0, 0, 1},
				new long[] {100L, 200L, 5L},
				new long[] {1234L << 16, (1234L << 16) | 17, 9_999_999_999L}
				);
		}

	private static byte[] encode(final VBIIndexCodec.Content content) throws IOException {
		final ByteArrayOutputStream os = new ByteArrayOutputStream();
		VBIIndexCodec.encode(os, content);
		return os.toByteArray();
		}

	@Test
	public void encodeDecode() throws IOException {
		final VBIIndexCodec.Content content = createContent();
		final VBIIndexCodec.Content copy = VBIIndexCodec.decode(new ByteArrayInputStream(encode(content)));
		Assert.assertEquals(copy.getSampleCount(), 3L);
		Assert.assertEquals(copy.getMarkerCount(), 3);
		Assert.assertEquals(copy.getChromosomes(), content.getChromosomes());
		Assert.assertEquals(copy.getChromIds(), content.getChromIds());
		Assert.assertEquals(copy.getPositions(), content.getPositions());
		Assert.assertEquals(copy.getOffsets(), content.getOffsets());
		}

	@Test
	public void layoutIsLittleEndian() throws IOException {
		final byte[] array = encode(createContent());
		final ByteBuffer bb = ByteBuffer.wrap(array).order(ByteOrder.LITTLE_ENDIAN);
		final byte[] magic = new byte[4];
		bb.get(magic);
		Assert.assertEquals(magic, VBIIndexCodec.MAGIC);
		Assert.assertEquals(bb.getInt(), VBIIndexCodec.VERSION);
		Assert.assertEquals(bb.getLong(), 3L);
		Assert.assertEquals(bb.getLong(), 3L);
		Assert.assertEquals(bb.getInt(), 2);
		Assert.assertEquals(bb.getInt(), 4);
		bb.position(bb.position() + 4);
		final int len = bb.getInt();
		Assert.assertEquals(len, "chré:2".getBytes(StandardCharsets.UTF_8).length);
		bb.position(bb.position() + len);
		// first triplet
		Assert.assertEquals(bb.getInt(), 0);
		Assert.assertEquals(bb.getLong(), 100L);
		Assert.assertEquals(bb.getLong(), 1234L << 16);
		Assert.assertEquals(bb.remaining(), 2 * (4 + 8 + 8));
		}

	@Test
	public void emptyIndex() throws IOException {
		final VBIIndexCodec.Content content = new VBIIndexCodec.Content(0L, Arrays.asList(), new int[0], new long[0], new long[0]);
		final VBIIndexCodec.Content copy = VBIIndexCodec.decode(new ByteArrayInputStream(encode(content)));
		Assert.assertEquals(copy.getMarkerCount(), 0);
		Assert.assertTrue(copy.getChromosomes().isEmpty());
		}

	@Test
	public void everyTruncationIsAFormatError() throws IOException {
		final byte[] array = encode(createContent());
		for(int len=0; len < array.length; len++) {
			try {
				VBIIndexCodec.decode(new ByteArrayInputStream(Arrays.copyOf(array, len)));
				Assert.fail("truncated at "+len+" should fail");
				}
			catch(final VBIFormatException err) {
				Assert.assertNotNull(err.getMessage());
				}
			}
		}

	@Test(expectedExceptions = VBIFormatException.class)
	public void badMagic() throws IOException {
		final byte[] array = encode(createContent());
		array[0] = 'X';
		VBIIndexCodec.decode(new ByteArrayInputStream(array));
		}

	@Test(expectedExceptions = VBIFormatException.class)
	public void badVersion() throws IOException {
		final byte[] array = encode(createContent());
		array[4] = 99;
		VBIIndexCodec.decode(new ByteArrayInputStream(array));
		}

	@Test(expectedExceptions = VBIFormatException.class)
	public void negativeMarkerCount() throws IOException {
		final byte[] array = encode(createContent());
		// marker_count starts at byte 16, its last byte holds the sign
		array[16 + 7] = (byte)0x80;
		VBIIndexCodec.decode(new ByteArrayInputStream(array));
		}

	@Test(expectedExceptions = VBIFormatException.class)
	public void chromosomeIdOutOfRange() throws IOException {
		final VBIIndexCodec.Content content = new VBIIndexCodec.Content(0L, Arrays.asList("chr1"),
				new int[] {0}, new long[] {1L}, new long[] {0L});
		final byte[] array = encode(content);
		// header is 28 bytes, then 4+4 bytes for "chr1", then the first chromosome id
		array[28 + 8] = 1;
		VBIIndexCodec.decode(new ByteArrayInputStream(array));
		}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void contentRejectsBadChromosomeId() {
		new VBIIndexCodec.Content(0L, Arrays.asList("chr1"), new int[] {0, 1}, new long[] {1L, 2L}, new long[] {0L, 1L});
		}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void contentRejectsNegativeChromosomeId() {
		new VBIIndexCodec.Content(0L, Arrays.asList("chr1"), new int[] {-1}, new long[] {1L}, new long[] {0L});
		}

	@Test
	public void contentCopiesItsArrays() {
		final int[] ids = new int[] {0, 0};
		final long[] pos = new long[] {100L, 200L};
		final long[] off = new long[] {10L, 20L};
		final VBIIndexCodec.Content content = new VBIIndexCodec.Content(0L, Arrays.asList("chr1", "chr2"), ids, pos, off);
		ids[0] = 1;
		pos[0] = 5000L;
		off[0] = 99L;
		Assert.assertEquals(content.getChromIds(), new int[] {0, 0});
		Assert.assertEquals(content.getPositions(), new long[] {100L, 200L});
		Assert.assertEquals(content.getOffsets(), new long[] {10L, 20L});
		content.getPositions()[1] = 7L;
		content.getOffsets()[1] = 7L;
		content.getChromIds()[1] = 1;
		Assert.assertEquals(content.getPositions()[1], 200L);
		Assert.assertEquals(content.getOffsets()[1], 20L);
		Assert.assertEquals(content.getChromIds()[1], 0);
		}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void arraysMustHaveTheSameLength() {
		new VBIIndexCodec.Content(0L, Arrays.asList("chr1"), new int[] {0}, new long[0], new long[] {0L});
		}
}
