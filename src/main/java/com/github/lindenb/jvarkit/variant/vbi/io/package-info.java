/**
Readers for VCF, bgzipped VCF and BCF 2.1/2.2 files that can report
and restore their position between two records.

@author Pierre Lindenbaum
*/
package com.github.lindenb.jvarkit.variant.vbi.io;
