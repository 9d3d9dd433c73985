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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFConstants;

/**
 * A record fetched from the source with the offset stored in a {@link VBIIndex}.
 * A record that could not be read is {@link #isMissing()}: all its fields are set to their sentinel
 * (null for the strings, 0 for the numbers, NaN for the quality).
 * @author Pierre Lindenbaum
 */
public final class VBIRecord {
	private final int ordinal;
	private final boolean missing;
	private final String contig;
	private final long position;
	private final String id;
	private final String ref;
	private final String alt;
	private final double qual;
	private final String filter;
	private final int alleleCount;
	private final VariantContext ctx;
	private Map<String, AnnotationTable> annotations = Collections.emptyMap();
	private Map<String, Object> info = Collections.emptyMap();
	private List<String> formatKeys = Collections.emptyList();
	private Map<String, String> genotypes = Collections.emptyMap();

	private VBIRecord(final int ordinal) {
		this.ordinal = ordinal;
		this.missing = true;
		this.contig = null;
		this.position = 0L;
		this.id = null;
		this.ref = null;
		this.alt = null;
		this.qual = Double.NaN;
		this.filter = null;
		this.alleleCount = 0;
		this.ctx = null;
		}

	VBIRecord(final int ordinal,final VariantContext ctx) {
		this.ordinal = ordinal;
		this.missing = false;
		this.ctx = ctx;
		this.contig = ctx.getContig();
		this.position = ctx.getStart();
		final String theId = ctx.getID();
		this.id = (theId==null || theId.isEmpty() || theId.equals(VCFConstants.EMPTY_ID_FIELD) ? null : theId);
		this.ref = ctx.getReference().getDisplayString();
		this.alt = ctx.getAlternateAlleles().isEmpty() ?
				VCFConstants.EMPTY_ALTERNATE_ALLELE_FIELD :
				ctx.getAlternateAlleles().stream().map(Allele::getDisplayString).collect(Collectors.joining(","));
		this.qual = ctx.hasLog10PError() ? ctx.getPhredScaledQual() : Double.NaN;
		this.filter = ctx.isFiltered() ?
				ctx.getFilters().stream().sorted().collect(Collectors.joining(";")) :
				VCFConstants.PASSES_FILTERS_v4;
		this.alleleCount = ctx.getNAlleles();
		}

	/** @return a record that could not be read */
	public static VBIRecord missing(final int ordinal) {
		return new VBIRecord(ordinal);
		}

	/** @return the 0-based ordinal of this record in the source */
	public int getOrdinal() {
		return this.ordinal;
		}

	/** @return true if this record could not be read */
	public boolean isMissing() {
		return this.missing;
		}

	public String getContig() {
		return this.contig;
		}

	/** @return the 1-based position */
	public long getPosition() {
		return this.position;
		}

	/** @return the ID or null if there is no ID */
	public String getId() {
		return this.id;
		}

	public boolean hasId() {
		return this.id!=null;
		}

	public String getRef() {
		return this.ref;
		}

	/** @return the comma-separated alternate alleles or '.' */
	public String getAlt() {
		return this.alt;
		}

	/** @return the phred-scaled quality or NaN */
	public double getQual() {
		return this.qual;
		}

	public boolean hasQual() {
		return !Double.isNaN(this.qual);
		}

	/** @return the semicolon-separated filters or PASS */
	public String getFilter() {
		return this.filter;
		}

	/** @return the number of alleles, REF included */
	public int getAlleleCount() {
		return this.alleleCount;
		}

	/** @return the decoded record, or null if missing */
	public VariantContext getVariantContext() {
		return this.ctx;
		}

	/** @return the decoded annotations, by INFO key */
	public Map<String, AnnotationTable> getAnnotations() {
		return this.annotations;
		}

	/** @return the decoded annotation for the key or null if the header does not declare it */
	public AnnotationTable getAnnotation(final String key) {
		return this.annotations.get(key);
		}

	/** @return the INFO fields, empty unless requested */
	public Map<String, Object> getInfo() {
		return this.info;
		}

	/** @return the FORMAT keys, empty unless requested */
	public List<String> getFormatKeys() {
		return this.formatKeys;
		}

	/** @return the GT of each sample, empty unless requested */
	public Map<String, String> getGenotypes() {
		return this.genotypes;
		}

	void setAnnotations(final Map<String, AnnotationTable> annotations) {
		this.annotations = Collections.unmodifiableMap(annotations);
		}

	void setInfo(final Map<String, Object> info) {
		this.info = Collections.unmodifiableMap(info);
		}

	void setFormatKeys(final List<String> formatKeys) {
		this.formatKeys = Collections.unmodifiableList(formatKeys);
		}

	void setGenotypes(final Map<String, String> genotypes) {
		this.genotypes = Collections.unmodifiableMap(genotypes);
		}

	@Override
	public String toString() {
		if(this.missing) return "#"+this.ordinal+"(missing)";
		return "#"+this.ordinal+" "+this.contig+":"+this.position+" "+
				(this.id==null?".":this.id)+" "+this.ref+" "+this.alt+" "+
				(hasQual()?String.valueOf(this.qual):".")+" "+this.filter;
		}
}
