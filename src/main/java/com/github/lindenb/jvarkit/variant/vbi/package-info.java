/**

This package is a "variant block index" (VBI) for VCF and BCF files:
a list of (chromosome, position, file offset) for each record of a sorted file,
saved in a small binary file. Records can then be fetched by region or by their
index in the file, without tabix or csi index.

Usage:

<pre>
Path vbi = VBIIndexer.index(vcfPath, null, 1);
try(VBIIndex idx = VBIIndex.load(vbi)) {
	int[] ordinals = idx.queryRegionIndexed("chr1:100-200");
	for(VBIRecord rec: new VBIRecordMaterializer().materialize(vcfPath, idx, ordinals)) {
		System.out.println(rec.getContig()+":"+rec.getPosition());
		}
	}
</pre>

@author Pierre Lindenbaum

*/
package com.github.lindenb.jvarkit.variant.vbi;
