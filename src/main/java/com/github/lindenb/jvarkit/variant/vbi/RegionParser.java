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

/**
 * Parses a comma-separated list of regions. Each region is one of
 * <ul>
 * <li><code>CHROM</code> : the whole chromosome</li>
 * <li><code>CHROM:POS</code> : a single position</li>
 * <li><code>CHROM:START-END</code> : a closed range</li>
 * </ul>
 * The chromosome is split from the coordinates at the last colon, so names
 * like <code>HLA-DQA1*01:01:02:134-14151</code> are accepted.
 * Chromosome names are not checked against any index.
 * @author Pierre Lindenbaum
 */
public class RegionParser {

	private RegionParser() {
		}

	/**
	 * parse a comma-separated list of regions
	 * @param str the regions
	 * @return the regions, in input order. Empty tokens are ignored.
	 * @throws VBIRegionException on malformed input
	 */
	public static List<Region> parseRegions(final String str) {
		if(str==null) throw new VBIRegionException("region string is null");
		final List<Region> regions = new ArrayList<>();
		for(final String token: str.split(",")) {
			if(token.trim().isEmpty()) continue;
			regions.add(parseRegion(token));
			}
		return Collections.unmodifiableList(regions);
		}

	/**
	 * parse a single region
	 * @param token the region
	 * @return the region
	 * @throws VBIRegionException on malformed input
	 */
	public static Region parseRegion(final String token) {
		if(token==null) throw new VBIRegionException("region is null");
		final String s = token.trim();
		if(s.isEmpty()) throw new VBIRegionException("empty region");
		final int colon = s.lastIndexOf(':');
		if(colon==-1) {
			return Region.ofContig(s);
			}
		final String contig = s.substring(0, colon);
		if(contig.isEmpty()) throw new VBIRegionException("no chromosome in region \""+token+"\"");
		final String coords = s.substring(colon+1);
		final int hyphen = coords.indexOf('-');
		if(hyphen==-1) {
			return Region.ofPoint(contig, parseCoordinate(coords, "position", token));
			}
		final long start = parseCoordinate(coords.substring(0, hyphen), "start", token);
		final long end = parseCoordinate(coords.substring(hyphen+1), "end", token);
		return new Region(contig, start, end, false);
		}

	private static long parseCoordinate(final String str,final String what,final String token) {
		// thousands separators are not allowed: the comma separates the regions
		final String s = str.trim();
		if(s.isEmpty()) throw new VBIRegionException("empty "+what+" in region \""+token+"\"");
		for(int i=0;i< s.length();i++) {
			if(!Character.isDigit(s.charAt(i))) {
				throw new VBIRegionException("invalid "+what+" in region \""+token+"\": \""+str+"\"");
				}
			}
		try {
			return Long.parseLong(s);
			}
		catch(final NumberFormatException err) {
			throw new VBIRegionException("invalid "+what+" in region \""+token+"\": \""+str+"\"", err);
			}
		}
}
