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

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import htsjdk.variant.variantcontext.VariantContext;

public class VBIRecordMaterializerTest {
	private Path tmpDir;
	private final List<VariantContext> variants = VariantFixtures.createVariants(300, true);
	private final List<Path> sources = new ArrayList<>();

	@BeforeClass
	public void createFixtures() throws IOException {
		this.tmpDir = VariantFixtures.createTempDir();
		this.sources.addAll(VariantFixtures.writeAll(this.tmpDir, "materialize", VariantFixtures.createHeader(true), this.variants));
		}

	@DataProvider(name = "sources")
	public Iterator<Object[]> createSources() {
		return this.sources.stream().map(P->new Object[] {P}).iterator();
		}

	private VBIIndex buildAndLoad(final Path source) throws IOException {
		final Path vbi = VBIIndexer.index(source, this.tmpDir.resolve(source.getFileName().toString()+".vbi"), 1);
		vbi.toFile().deleteOnExit();
		return VBIIndex.load(vbi);
		}

	private static void assertSameRecord(final VBIRecord rec,final VariantContext expect) {
		Assert.assertFalse(rec.isMissing());
		Assert.assertEquals(rec.getContig(), expect.getContig());
		Assert.assertEquals(rec.getPosition(), (long)expect.getStart());
		if(expect.hasID()) {
			Assert.assertEquals(rec.getId(), expect.getID());
			Assert.assertTrue(rec.hasId());
			}
		else
			{
			Assert.assertNull(rec.getId());
			Assert.assertFalse(rec.hasId());
			}
		Assert.assertEquals(rec.getRef(), expect.getReference().getDisplayString());
		Assert.assertEquals(rec.getAlt(), expect.getAlternateAlleles().stream().map(A->A.getDisplayString()).collect(Collectors.joining(",")));
		Assert.assertEquals(rec.getAlleleCount(), expect.getNAlleles());
		if(expect.hasLog10PError()) {
			Assert.assertTrue(rec.hasQual());
			Assert.assertEquals(rec.getQual(), expect.getPhredScaledQual(), 0.01);
			}
		else
			{
			Assert.assertFalse(rec.hasQual());
			Assert.assertTrue(Double.isNaN(rec.getQual()));
			}
		Assert.assertEquals(rec.getFilter(), expect.isFiltered() ? String.join(";", expect.getFilters()) : "PASS");
		Assert.assertNotNull(rec.getVariantContext());
		}

	@Test(dataProvider = "sources")
	public void materializeAll(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final int[] ordinals = index.queryIndexRange(1L, index.getMarkerCount());
			final List<VBIRecord> records = new VBIRecordMaterializer().materialize(source, index, ordinals);
			Assert.assertEquals(records.size(), this.variants.size());
			for(int i=0;i< records.size();i++) {
				Assert.assertEquals(records.get(i).getOrdinal(), i);
				assertSameRecord(records.get(i), this.variants.get(i));
				}
			}
		}

	@Test(dataProvider = "sources")
	public void materializeInAnyOrder(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final int[] ordinals = new int[] {250, 3, 3, 299, 0, 120};
			final List<VBIRecord> records = new VBIRecordMaterializer().materialize(source, index, ordinals);
			Assert.assertEquals(records.size(), ordinals.length);
			for(int i=0;i< ordinals.length;i++) {
				Assert.assertEquals(records.get(i).getOrdinal(), ordinals[i]);
				assertSameRecord(records.get(i), this.variants.get(ordinals[i]));
				}
			}
		}

	@Test(dataProvider = "sources")
	public void materializeRegion(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final VariantContext first = this.variants.get(10);
			final VariantContext last = this.variants.get(40);
			final String region = first.getContig()+":"+first.getStart()+"-"+last.getStart();
			final List<VBIRecord> records = new VBIRecordMaterializer().materializeRegion(source, index, region);
			final List<Integer> expect = VariantFixtures.expectedOrdinals(this.variants, first.getContig(), first.getStart(), last.getStart());
			Assert.assertEquals(records.stream().map(VBIRecord::getOrdinal).collect(Collectors.toList()), expect);
			for(final VBIRecord rec: records) {
				Assert.assertTrue(first.getStart() <= rec.getPosition() && rec.getPosition() <= last.getStart());
				assertSameRecord(rec, this.variants.get(rec.getOrdinal()));
				}
			final List<VBIRecord> range = new VBIRecordMaterializer().materializeIndexRange(source, index, 295L, 1000L);
			Assert.assertEquals(range.size(), 6);
			assertSameRecord(range.get(5), this.variants.get(299));
			}
		}

	@Test(dataProvider = "sources")
	public void annotations(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final List<VBIRecord> records = new VBIRecordMaterializer().materialize(source, index, new int[] {0, 1, 2});
			// n%4==0 : no CSQ
			final AnnotationTable t0 = records.get(0).getAnnotation("CSQ");
			Assert.assertNotNull(t0);
			Assert.assertTrue(t0.isAbsent());
			Assert.assertEquals(t0.size(), 0);
			// n%4==1 : two annotations
			final AnnotationTable t1 = records.get(1).getAnnotation("CSQ");
			Assert.assertFalse(t1.isAbsent());
			Assert.assertEquals(t1.getFormat().getFields().size(), 3);
			Assert.assertEquals(t1.size(), 2);
			Assert.assertEquals(t1.get(0, "Consequence"), "missense_variant");
			Assert.assertEquals(t1.get(1, "Consequence"), "synonymous_variant");
			Assert.assertEquals(t1.getColumn("SYMBOL").get(1), "GENE2");
			Assert.assertEquals(t1.getRow(0).get(0), "C");
			// n%4==2 : one annotation
			final AnnotationTable t2 = records.get(2).getAnnotation("CSQ");
			Assert.assertEquals(t2.size(), 1);
			Assert.assertEquals(t2.get(0, "SYMBOL"), "GENE2");
			// DP is not an annotation
			Assert.assertNull(records.get(1).getAnnotation("DP"));
			Assert.assertEquals(records.get(1).getAnnotations().size(), 1);

			final List<VBIRecord> raw = new VBIRecordMaterializer().
					setDecodeAnnotations(false).
					materialize(source, index, new int[] {1});
			Assert.assertTrue(raw.get(0).getAnnotations().isEmpty());
			}
		}

	@Test(dataProvider = "sources")
	public void infoFormatAndGenotypes(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final List<VBIRecord> records = new VBIRecordMaterializer().
					setIncludeInfo(true).
					setIncludeFormat(true).
					setIncludeGenotypes(true).
					materialize(source, index, new int[] {0, 1});
			Assert.assertTrue(records.get(0).getInfo().containsKey("DP"));
			Assert.assertEquals(Integer.parseInt(records.get(0).getInfo().get("DP").toString()), 10);
			Assert.assertEquals(records.get(0).getFormatKeys().get(0), "GT");
			Assert.assertEquals(records.get(0).getGenotypes().get("S1"), "0/1");
			Assert.assertEquals(records.get(0).getGenotypes().get("S2"), "1/1");
			Assert.assertEquals(records.get(1).getGenotypes().get("S2"), "./.");

			final List<VBIRecord> lean = new VBIRecordMaterializer().materialize(source, index, new int[] {0});
			Assert.assertTrue(lean.get(0).getInfo().isEmpty());
			Assert.assertTrue(lean.get(0).getFormatKeys().isEmpty());
			Assert.assertTrue(lean.get(0).getGenotypes().isEmpty());
			}
		}

	@Test(dataProvider = "sources")
	public void outOfRangeOrdinalsGiveMissingRows(final Path source) throws IOException {
		try(VBIIndex index = buildAndLoad(source)) {
			final List<VBIRecord> records = new VBIRecordMaterializer().materialize(source, index, new int[] {-1, 5, 100_000});
			Assert.assertEquals(records.size(), 3);
			Assert.assertTrue(records.get(0).isMissing());
			Assert.assertEquals(records.get(0).getOrdinal(), -1);
			Assert.assertNull(records.get(0).getContig());
			Assert.assertTrue(Double.isNaN(records.get(0).getQual()));
			assertSameRecord(records.get(1), this.variants.get(5));
			Assert.assertTrue(records.get(2).isMissing());

			final List<VariantContext> raw = new VBIRecordMaterializer().fetchVariants(source, index, new int[] {-1, 5});
			Assert.assertNull(raw.get(0));
			Assert.assertEquals(raw.get(1).getStart(), this.variants.get(5).getStart());
			}
		}

	@Test
	public void badOffsetGivesAMissingRow() throws IOException {
		final Path source = this.sources.stream().filter(P->P.toString().endsWith(".vcf")).findFirst().get();
		try(VBIIndex good = buildAndLoad(source)) {
			final long[] offsets = good.getOffsets(good.queryIndexRange(1L, good.getMarkerCount()));
			// second record points past the end of the file
			offsets[1] = Files.size(source) + 1000L;
			final VBIIndexCodec.Content content = new VBIIndexCodec.Content(
					good.getSampleCount(),
					good.getChromosomes(),
					good.extractRanges().stream().mapToInt(L->good.getChromosomes().indexOf(L.getContig())).toArray(),
					good.extractRanges().stream().mapToLong(IndexedLocus::getPosition).toArray(),
					offsets);
			try(VBIIndex bad = new VBIIndex(content)) {
				final List<VBIRecord> records = new VBIRecordMaterializer().materialize(source, bad, new int[] {0, 1, 2});
				assertSameRecord(records.get(0), this.variants.get(0));
				Assert.assertTrue(records.get(1).isMissing());
				Assert.assertEquals(records.get(1).getOrdinal(), 1);
				assertSameRecord(records.get(2), this.variants.get(2));
				}
			}
		}

	@Test
	public void sourceThatCannotBeOpenedAbortsTheCall() throws IOException {
		try(VBIIndex index = buildAndLoad(this.sources.get(0))) {
			try {
				new VBIRecordMaterializer().materialize(this.tmpDir.resolve("nothing-here.vcf"), index, new int[] {0});
				Assert.fail();
				}
			catch(final IOException err) {
				Assert.assertNotNull(err.getMessage());
				}
			}
		}

	@Test
	public void sourceWithoutHeaderAbortsTheCall() throws IOException {
		final Path noHeader = this.tmpDir.resolve("noheader.vcf");
		try(RandomAccessFile raf = new RandomAccessFile(noHeader.toFile(), "rw")) {
			raf.write("chr1\t1\t.\tA\tC\t.\t.\t.\n".getBytes("UTF-8"));
			}
		try(VBIIndex index = buildAndLoad(this.sources.get(0))) {
			new VBIRecordMaterializer().materialize(noHeader, index, new int[] {0});
			Assert.fail();
			}
		catch(final IOException err) {
			Assert.assertTrue(err.getMessage().contains("#CHROM"));
			}
		}

	@Test
	public void recordToString() {
		Assert.assertTrue(VBIRecord.missing(3).toString().contains("missing"));
		}
}
