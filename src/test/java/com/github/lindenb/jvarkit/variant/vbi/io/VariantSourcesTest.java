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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.github.lindenb.jvarkit.variant.vbi.VariantFixtures;

import htsjdk.variant.variantcontext.VariantContext;

public class VariantSourcesTest {
	private Path tmpDir;
	private final List<VariantContext> variants = VariantFixtures.createVariants(120, true);

	@BeforeClass
	public void createFixtures() throws IOException {
		this.tmpDir = VariantFixtures.createTempDir();
		}

	@DataProvider(name = "kinds")
	public Object[][] createKinds() {
		return new Object[][] {
			{VariantFixtures.Kind.VCF, SourceCodec.PLAIN, "VCFTextSource"},
			{VariantFixtures.Kind.VCF_GZ, SourceCodec.BGZF, "VCFTextSource"},
			{VariantFixtures.Kind.BCF, null, "BCFSource"}
			};
		}

	private Path write(final VariantFixtures.Kind kind) throws IOException {
		return VariantFixtures.write(this.tmpDir, "source", kind, VariantFixtures.createHeader(true), this.variants);
		}

	@Test(dataProvider = "kinds")
	public void readAll(final VariantFixtures.Kind kind,final SourceCodec codec,final String className) throws IOException {
		final Path path = write(kind);
		try(VariantSource src = VariantSources.open(path, 1)) {
			Assert.assertEquals(src.getClass().getSimpleName(), className);
			if(codec!=null) Assert.assertEquals(src.getCodec(), codec);
			Assert.assertEquals(src.getPath(), path);
			Assert.assertEquals(src.getHeader().getGenotypeSamples(), VariantFixtures.SAMPLES);
			Assert.assertNotNull(src.getHeader().getInfoHeaderLine("CSQ"));
			int n = 0;
			VariantContext ctx;
			while((ctx = src.next())!=null) {
				final VariantContext expect = this.variants.get(n);
				Assert.assertEquals(ctx.getContig(), expect.getContig());
				Assert.assertEquals(ctx.getStart(), expect.getStart());
				Assert.assertEquals(ctx.getEnd(), expect.getEnd());
				Assert.assertEquals(ctx.getAlleles(), expect.getAlleles());
				Assert.assertEquals(ctx.getNSamples(), 2);
				n++;
				}
			Assert.assertEquals(n, this.variants.size());
			// still at the end
			Assert.assertNull(src.next());
			}
		}

	@Test(dataProvider = "kinds")
	public void seekBack(final VariantFixtures.Kind kind,final SourceCodec codec,final String className) throws IOException {
		final Path path = write(kind);
		try(VariantSource src = VariantSources.open(path, 1)) {
			final List<Long> offsets = new ArrayList<>();
			for(;;) {
				final long offset = src.getPosition();
				if(src.next()==null) break;
				offsets.add(offset);
				}
			Assert.assertEquals(offsets.size(), this.variants.size());
			for(final int i: new int[] {77, 0, 119, 5, 5}) {
				src.seek(offsets.get(i));
				final VariantContext ctx = src.next();
				Assert.assertEquals(ctx.getContig(), this.variants.get(i).getContig());
				Assert.assertEquals(ctx.getStart(), this.variants.get(i).getStart());
				Assert.assertEquals(src.getPosition() > offsets.get(i), true);
				}
			}
		}

	@Test
	public void plainOffsetsAreByteOffsets() throws IOException {
		final Path path = write(VariantFixtures.Kind.VCF);
		final byte[] content = Files.readAllBytes(path);
		try(VariantSource src = VariantSources.open(path, 1)) {
			final long offset = src.getPosition();
			// the first record starts just after the #CHROM line
			Assert.assertEquals(content[(int)offset - 1], (byte)'\n');
			Assert.assertEquals(content[(int)offset], (byte)'c');
			Assert.assertEquals(SourceCodec.PLAIN.describe(offset), String.valueOf(offset));
			}
		}

	@Test
	public void bgzfDescribe() {
		Assert.assertEquals(SourceCodec.BGZF.describe((1234L << 16) | 17L), "1234:17");
		}

	@Test
	public void asyncDecompression() throws IOException {
		final Path path = write(VariantFixtures.Kind.VCF_GZ);
		int n = 0;
		try(VariantSource src = VariantSources.open(path, 3)) {
			while(src.next()!=null) n++;
			}
		Assert.assertEquals(n, this.variants.size());
		}

	@Test(expectedExceptions = IOException.class)
	public void notAFile() throws IOException {
		VariantSources.open(this.tmpDir, 1);
		}

	@Test(expectedExceptions = IOException.class)
	public void emptyFile() throws IOException {
		final Path path = Files.createTempFile(this.tmpDir, "empty", ".vcf");
		VariantSources.open(path, 1);
		}

	@Test(expectedExceptions = IOException.class)
	public void gzipIsNotBgzf() throws IOException {
		final Path vcf = write(VariantFixtures.Kind.VCF);
		final Path gz = this.tmpDir.resolve("gzip.vcf.gz");
		try(OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
			Files.copy(vcf, out);
			}
		VariantSources.open(gz, 1);
		}

	@Test(expectedExceptions = IOException.class)
	public void seekOutOfFile() throws IOException {
		final Path path = write(VariantFixtures.Kind.VCF);
		try(VariantSource src = VariantSources.open(path, 1)) {
			src.seek(Files.size(path) + 1L);
			}
		}
}
