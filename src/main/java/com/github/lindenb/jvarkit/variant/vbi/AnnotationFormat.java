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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFInfoHeaderLine;

/**
 * The names of the sub-fields of a multi-valued INFO annotation, as declared in the header.
 * e.g. for VEP:
 * <pre>
 * ##INFO=&lt;ID=CSQ,Number=.,Type=String,Description="Consequence annotations from Ensembl VEP. Format: Allele|Consequence|IMPACT"&gt;
 * </pre>
 * @author Pierre Lindenbaum
 */
public final class AnnotationFormat {
	/** marker introducing the list of fields in the description */
	public static final String FORMAT_MARKER = "Format:";
	private final String key;
	private final List<String> fields;

	public AnnotationFormat(final String key,final List<String> fields) {
		if(key==null || key.isEmpty()) throw new IllegalArgumentException("empty key");
		if(fields==null || fields.isEmpty()) throw new IllegalArgumentException("no field for "+key);
		this.key = key;
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

	/** @return the INFO key */
	public String getKey() {
		return this.key;
		}

	/** @return the names of the sub-fields */
	public List<String> getFields() {
		return this.fields;
		}

	/** @return the index of a field or -1 */
	public int indexOf(final String field) {
		return this.fields.indexOf(field);
		}

	/**
	 * parse the description of an INFO header line
	 * @return the format or null if the description does not declare a pipe-delimited list of fields
	 */
	public static AnnotationFormat parse(final VCFInfoHeaderLine line) {
		return parse(line.getID(), line.getDescription());
		}

	/**
	 * parse a description
	 * @param key the INFO key
	 * @param description the description of the INFO key
	 * @return the format or null if the description does not declare a pipe-delimited list of fields
	 */
	public static AnnotationFormat parse(final String key,final String description) {
		if(description==null) return null;
		final int i = description.indexOf(FORMAT_MARKER);
		if(i==-1) return null;
		String s = description.substring(i + FORMAT_MARKER.length()).trim();
		if(s.length()>1 && (s.startsWith("'") || s.startsWith("\""))) {
			final char quote = s.charAt(0);
			s = s.substring(1);
			final int j = s.indexOf(quote);
			if(j!=-1) s = s.substring(0, j);
			}
		s = s.trim();
		if(s.indexOf('|')==-1) return null;
		final List<String> fields = new ArrayList<>();
		for(final String f: s.split("[|]", -1)) {
			fields.add(f.trim());
			}
		return new AnnotationFormat(key, fields);
		}

	/** @return all the annotations declared in the header, in the order of the header */
	public static List<AnnotationFormat> fromHeader(final VCFHeader header) {
		final List<AnnotationFormat> L = new ArrayList<>();
		for(final VCFInfoHeaderLine h: header.getInfoHeaderLines()) {
			final AnnotationFormat fmt = parse(h);
			if(fmt!=null) L.add(fmt);
			}
		return L;
		}

	@Override
	public String toString() {
		return this.key+":"+String.join("|", this.fields);
		}
}
