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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The decoded values of a multi-valued INFO annotation for one record:
 * one row per comma-separated group, one column per field of the {@link AnnotationFormat}.
 * A record without the INFO key gets an {@link #absent(AnnotationFormat)} table,
 * which is not the same thing as an empty table.
 * @author Pierre Lindenbaum
 */
public final class AnnotationTable {
	private final AnnotationFormat format;
	private final List<List<String>> rows;
	private final boolean absent;

	private AnnotationTable(final AnnotationFormat format,final List<List<String>> rows,final boolean absent) {
		this.format = format;
		this.rows = rows;
		this.absent = absent;
		}

	/** @return a table for a record that does not carry the annotation */
	public static AnnotationTable absent(final AnnotationFormat format) {
		return new AnnotationTable(format, Collections.emptyList(), true);
		}

	/**
	 * decode an INFO value
	 * @param format the annotation format
	 * @param value the raw attribute of the record: a String or a collection of Strings
	 * @return the table, {@link #absent(AnnotationFormat)} if value is null
	 */
	public static AnnotationTable parse(final AnnotationFormat format,final Object value) {
		if(value==null) return absent(format);
		final List<String> groups = new ArrayList<>();
		if(value instanceof Collection) {
			for(final Object o: Collection.class.cast(value)) {
				if(o==null) continue;
				groups.addAll(Arrays.asList(o.toString().split(",")));
				}
			}
		else if(value instanceof Object[]) {
			for(final Object o: Object[].class.cast(value)) {
				if(o==null) continue;
				groups.addAll(Arrays.asList(o.toString().split(",")));
				}
			}
		else
			{
			groups.addAll(Arrays.asList(value.toString().split(",")));
			}
		final List<List<String>> rows = new ArrayList<>(groups.size());
		for(final String group: groups) {
			if(group.isEmpty() || group.equals(".")) continue;
			rows.add(Collections.unmodifiableList(Arrays.asList(group.split("[|]", -1))));
			}
		return new AnnotationTable(format, Collections.unmodifiableList(rows), false);
		}

	public AnnotationFormat getFormat() {
		return this.format;
		}

	/** @return true if the record does not carry the annotation */
	public boolean isAbsent() {
		return this.absent;
		}

	/** @return the number of annotations */
	public int size() {
		return this.rows.size();
		}

	/** @return the values of the idx-th annotation */
	public List<String> getRow(final int idx) {
		return this.rows.get(idx);
		}

	public List<List<String>> getRows() {
		return this.rows;
		}

	/**
	 * @param row the row index
	 * @param field the name of the field
	 * @return the value or null if the field is not declared or not available in this row
	 */
	public String get(final int row,final String field) {
		final int col = this.format.indexOf(field);
		if(col==-1) return null;
		final List<String> values = this.rows.get(row);
		return col < values.size() ? values.get(col) : null;
		}

	/** @return the values of a field over all the rows, null for the missing ones */
	public List<String> getColumn(final String field) {
		final List<String> L = new ArrayList<>(this.rows.size());
		for(int i=0;i< this.rows.size();i++) {
			L.add(get(i, field));
			}
		return L;
		}

	@Override
	public String toString() {
		if(this.absent) return this.format.getKey()+"(absent)";
		return this.format.getKey()+this.rows;
		}
}
