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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.github.lindenb.jvarkit.variant.vbi.io.VariantSource;
import com.github.lindenb.jvarkit.variant.vbi.io.VariantSources;

import htsjdk.samtools.util.Log;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFConstants;

/**
 * Reads the records of a VCF or BCF at the offsets stored in a {@link VBIIndex}.
 *
 * The source is opened for each call and closed before returning, so a materializer
 * can be used by concurrent callers. A record that cannot be seeked or read gives a
 * {@link VBIRecord#missing(int)} row and the other records are still returned.
 *
 * <pre>
 * try(VBIIndex idx = VBIIndex.load(vbiPath)) {
 *	List&lt;VBIRecord&gt; L = new VBIRecordMaterializer().
 *		materialize(vcfPath, idx, idx.queryRegionIndexed("chr1:100-200"));
 *	}
 * </pre>
 * @author Pierre Lindenbaum
 */
public class VBIRecordMaterializer {
	private static final Log LOG=Log.getInstance(VBIRecordMaterializer.class);
	private int threads = 1;
	private boolean decodeAnnotations = true;
	private boolean includeInfo = false;
	private boolean includeFormat = false;
	private boolean includeGenotypes = false;

	public VBIRecordMaterializer() {
		}

	/** decompression threads hint */
	public VBIRecordMaterializer setThreads(final int threads) {
		this.threads = Math.max(1, threads);
		return this;
		}

	/** decode the INFO annotations declared with a 'Format:' description. Default: true */
	public VBIRecordMaterializer setDecodeAnnotations(final boolean b) {
		this.decodeAnnotations = b;
		return this;
		}

	/** fill {@link VBIRecord#getInfo()}. Default: false */
	public VBIRecordMaterializer setIncludeInfo(final boolean b) {
		this.includeInfo = b;
		return this;
		}

	/** fill {@link VBIRecord#getFormatKeys()}. Default: false */
	public VBIRecordMaterializer setIncludeFormat(final boolean b) {
		this.includeFormat = b;
		return this;
		}

	/** fill {@link VBIRecord#getGenotypes()}. Default: false */
	public VBIRecordMaterializer setIncludeGenotypes(final boolean b) {
		this.includeGenotypes = b;
		return this;
		}

	/**
	 * read the records at the given ordinals
	 * @param source the VCF or BCF that was indexed
	 * @param index the loaded index
	 * @param ordinals the 0-based ordinals
	 * @return one record per ordinal, in the same order
	 * @throws IOException if the source cannot be opened or its header cannot be read
	 */
	public List<VBIRecord> materialize(final Path source,final VBIIndex index,final int[] ordinals) throws IOException {
		final List<VBIRecord> records = new ArrayList<>(ordinals.length);
		try(VariantSource src = VariantSources.open(source, this.threads)) {
			final List<AnnotationFormat> formats = this.decodeAnnotations ?
					AnnotationFormat.fromHeader(src.getHeader()) :
					new ArrayList<>();
			for(final int ordinal: ordinals) {
				final VariantContext ctx = fetch(src, index, ordinal);
				records.add(ctx==null ? VBIRecord.missing(ordinal) : toRecord(ordinal, ctx, formats));
				}
			}
		return records;
		}

	/** read the records of the regions, see {@link VBIIndex#queryRegionIndexed(String)} */
	public List<VBIRecord> materializeRegion(final Path source,final VBIIndex index,final String regions) throws IOException {
		return materialize(source, index, index.queryRegionIndexed(regions));
		}

	/** read the records between two 1-based indexes, see {@link VBIIndex#queryIndexRange(long, long)} */
	public List<VBIRecord> materializeIndexRange(final Path source,final VBIIndex index,final long start1,final long end1) throws IOException {
		return materialize(source, index, index.queryIndexRange(start1, end1));
		}

	/**
	 * read the raw records at the given ordinals
	 * @return one item per ordinal, null for the records that could not be read
	 * @throws IOException if the source cannot be opened or its header cannot be read
	 */
	public List<VariantContext> fetchVariants(final Path source,final VBIIndex index,final int[] ordinals) throws IOException {
		final List<VariantContext> L = new ArrayList<>(ordinals.length);
		try(VariantSource src = VariantSources.open(source, this.threads)) {
			for(final int ordinal: ordinals) {
				L.add(fetch(src, index, ordinal));
				}
			}
		return L;
		}

	/** seek and read one record, returns null on failure */
	private VariantContext fetch(final VariantSource src,final VBIIndex index,final int ordinal) {
		if(ordinal < 0 || ordinal >= index.getMarkerCount()) {
			LOG.warn("ordinal "+ordinal+" is out of range [0,"+index.getMarkerCount()+")");
			return null;
			}
		final long offset = index.getOffset(ordinal);
		try {
			src.seek(offset);
			final VariantContext ctx = src.next();
			if(ctx==null) {
				LOG.warn("no record at offset "+src.getCodec().describe(offset)+" for ordinal "+ordinal+" in "+src.getPath());
				}
			return ctx;
			}
		catch(final IOException|RuntimeException err) {
			LOG.warn(err, "cannot read record at offset "+src.getCodec().describe(offset)+" for ordinal "+ordinal+" in "+src.getPath());
			return null;
			}
		}

	private VBIRecord toRecord(final int ordinal,final VariantContext ctx,final List<AnnotationFormat> formats) {
		final VBIRecord rec = new VBIRecord(ordinal, ctx);
		if(!formats.isEmpty()) {
			final Map<String, AnnotationTable> annotations = new LinkedHashMap<>(formats.size());
			for(final AnnotationFormat fmt: formats) {
				annotations.put(fmt.getKey(), AnnotationTable.parse(fmt, ctx.getAttribute(fmt.getKey())));
				}
			rec.setAnnotations(annotations);
			}
		if(this.includeInfo) {
			rec.setInfo(new TreeMap<>(ctx.getAttributes()));
			}
		if(this.includeFormat) {
			rec.setFormatKeys(getFormatKeys(ctx));
			}
		if(this.includeGenotypes && ctx.hasGenotypes()) {
			final Map<String, String> gts = new LinkedHashMap<>(ctx.getNSamples());
			for(final Genotype g: ctx.getGenotypes()) {
				gts.put(g.getSampleName(), toGT(ctx, g));
				}
			rec.setGenotypes(gts);
			}
		return rec;
		}

	/** @return the FORMAT keys used by the genotypes of the record, GT first */
	static List<String> getFormatKeys(final VariantContext ctx) {
		final Set<String> keys = new LinkedHashSet<>();
		if(!ctx.hasGenotypes()) return new ArrayList<>(keys);
		for(final Genotype g: ctx.getGenotypes()) {
			if(g.isAvailable()) keys.add(VCFConstants.GENOTYPE_KEY);
			}
		for(final Genotype g: ctx.getGenotypes()) {
			if(g.isFiltered()) keys.add(VCFConstants.GENOTYPE_FILTER_KEY);
			if(g.hasGQ()) keys.add(VCFConstants.GENOTYPE_QUALITY_KEY);
			if(g.hasDP()) keys.add(VCFConstants.DEPTH_KEY);
			if(g.hasAD()) keys.add(VCFConstants.GENOTYPE_ALLELE_DEPTHS);
			if(g.hasPL()) keys.add(VCFConstants.GENOTYPE_PL_KEY);
			keys.addAll(g.getExtendedAttributes().keySet());
			}
		return new ArrayList<>(keys);
		}

	/** @return the genotype as written in a VCF, e.g. '0/1' */
	static String toGT(final VariantContext ctx,final Genotype g) {
		if(!g.isAvailable() || g.getPloidy()==0) return VCFConstants.EMPTY_GENOTYPE;
		final StringBuilder sb = new StringBuilder();
		final String sep = g.isPhased() ? VCFConstants.PHASED : VCFConstants.UNPHASED;
		for(int i=0;i< g.getPloidy();i++) {
			if(i>0) sb.append(sep);
			final Allele a = g.getAllele(i);
			if(a==null || a.isNoCall()) {
				sb.append(VCFConstants.EMPTY_ALLELE);
				}
			else
				{
				sb.append(ctx.getAlleleIndex(a));
				}
			}
		return sb.toString();
		}
}
