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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import htsjdk.samtools.util.BinaryCodec;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeEOFException;
import htsjdk.tribble.TribbleException;
import htsjdk.tribble.readers.LineIterator;
import htsjdk.tribble.readers.LineIteratorImpl;
import htsjdk.tribble.readers.SynchronousLineReader;
import htsjdk.variant.bcf2.BCFVersion;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.GenotypeBuilder;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import htsjdk.variant.vcf.VCFCodec;
import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFContigHeaderLine;
import htsjdk.variant.vcf.VCFFilterHeaderLine;
import htsjdk.variant.vcf.VCFFormatHeaderLine;
import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFHeaderLine;
import htsjdk.variant.vcf.VCFHeaderLineType;
import htsjdk.variant.vcf.VCFInfoHeaderLine;

/**
 * {@link VariantSource} for BCF 2.1 and 2.2, either BGZF-compressed or not.
 * @author Pierre Lindenbaum
 */
class BCFSource implements VariantSource {
	private static final Log LOG=Log.getInstance(BCFSource.class);
	static final byte[] MAGIC_HEADER_START = "BCF".getBytes(StandardCharsets.US_ASCII);

	private final Path path;
	private final PositionalInput input;
	private final BCFVersion version;
	private final VCFHeader header;
	/** the string dictionary, PASS is always the 0-th item */
	private final List<String> idx2word =new ArrayList<>();
	private final List<String> contigs;
	private byte[] buffer=null;

	BCFSource(final Path path,final PositionalInput input) throws IOException {
		this.path = path;
		this.input = input;
		try {
			@SuppressWarnings("resource")
			final BinaryCodec bc1 = new BinaryCodec(this.input);
			this.version = readVersion(bc1);
			if(this.version.getMajorVersion()!=2 || (this.version.getMinorVersion()!=1 && this.version.getMinorVersion()!=2)) {
				throw new IOException("Bad BCF version. Not handled "+this.version+" in "+path);
				}
			final int headerSizeInBytes =  uint32ToInt(bc1.readUInt());
			final byte[] headerBytes = new byte[headerSizeInBytes];
			bc1.readBytes(headerBytes);
			int len = headerBytes.length;
			while(len>0 && headerBytes[len-1]==0) len--;//skip EOF
			final LineIterator lr = new LineIteratorImpl(new SynchronousLineReader(new ByteArrayInputStream(headerBytes,0,len)));
			this.header=(VCFHeader)new VCFCodec().readActualHeader(lr);
			}
		catch(final RuntimeEOFException err) {
			throw new IOException("truncated BCF header in "+path, err);
			}
		catch(final TribbleException err) {
			throw new IOException("Cannot decode BCF header of "+path, err);
			}

		this.contigs = this.header.getContigLines().stream().
				map(VCFContigHeaderLine::getID).
				collect(Collectors.toList());
		if(this.contigs.isEmpty()) throw new IOException("no contig line in "+path);

		final Set<String> seen=new HashSet<>();
		this.idx2word.add(VCFConstants.PASSES_FILTERS_v4);
		seen.add(VCFConstants.PASSES_FILTERS_v4);
		for(VCFHeaderLine hl:this.header.getMetaDataInInputOrder()) {
			String s=null;
			if(hl instanceof VCFFilterHeaderLine) {
				s=VCFFilterHeaderLine.class.cast(hl).getID();
				}
			else if(hl instanceof VCFInfoHeaderLine) {
				s=VCFInfoHeaderLine.class.cast(hl).getID();
				}
			else if(hl instanceof VCFFormatHeaderLine) {
				s=VCFFormatHeaderLine.class.cast(hl).getID();
				}
			if(s==null || seen.contains(s)) continue;
			this.idx2word.add(s);
			seen.add(s);
			}
		LOG.debug("BCF "+this.version+" "+path+" dictionary size="+this.idx2word.size());
		}

	static BCFVersion readVersion(final BinaryCodec binaryCodec)  throws IOException {
		final byte[] magicBytes = new byte[MAGIC_HEADER_START.length];
		binaryCodec.readBytes(magicBytes);
		if (!Arrays.equals(magicBytes, MAGIC_HEADER_START) ) throw new IOException("Cannot read BCF MAGIC");
		final int majorByte =  binaryCodec.readUByte();
		final int minorByte =  binaryCodec.readUByte();
		return new BCFVersion(majorByte, minorByte);
		}

	@Override
	public Path getPath() {
		return this.path;
		}

	@Override
	public VCFHeader getHeader() {
		return this.header;
		}

	@Override
	public SourceCodec getCodec() {
		return this.input.getCodec();
		}

	@Override
	public long getPosition() throws IOException {
		return this.input.getPosition();
		}

	@Override
	public void seek(long offset) throws IOException {
		this.input.seek(offset);
		}

	private byte[] fillBuffer(BinaryCodec bc,int n) {
		if(this.buffer==null || this.buffer.length<n) {
			this.buffer=new byte[n];
			}
		bc.readBytes(this.buffer, 0, n);
		return this.buffer;
		}

	private String word(int idx) throws IOException {
		if(idx<0 || idx>=this.idx2word.size()) throw new IOException("string index out of dictionary "+idx+" in "+this.path);
		return this.idx2word.get(idx);
		}

	@Override
	public VariantContext next() throws IOException {
		@SuppressWarnings("resource")
		final BinaryCodec binaryCodec1 = new BinaryCodec(this.input);
		final int shared_length;
		try {
			shared_length = uint32ToInt(binaryCodec1.readUInt());
			}
		catch(final RuntimeEOFException err) {
			return null;
			}
		try {
			final int format_length = uint32ToInt(binaryCodec1.readUInt());
			final VariantContextBuilder vcb=new VariantContextBuilder();
			final List<Allele> alleles;
			final int n_fmt;
			fillBuffer(binaryCodec1,shared_length);
			try(ByteArrayInputStream is=new ByteArrayInputStream(this.buffer,0,shared_length)) {
				final BinaryCodec bc2 = new BinaryCodec(is);
				final int tid = bc2.readInt();
				if(tid<0 || tid>=this.contigs.size()) throw new IOException("contig index out of range "+tid+" in "+this.path);
				final int pos0= bc2.readInt();
				final int rlen= bc2.readInt();
				vcb.chr(this.contigs.get(tid));
				vcb.start(pos0+1L);
				vcb.stop(pos0+(long)Math.max(1,rlen));

				final float qual= bc2.readFloat();
				if(!BCFTypedData.isMissingFloat(qual)) {
					vcb.log10PError(qual/-10.0);
					}
				final int n_info = bc2.readUShort();
				final int n_allele = bc2.readUShort();
				final int n_fmt_sample = bc2.readInt();
				n_fmt = (n_fmt_sample >>> 24) & 0xFF;

				/** ID **/
				final String id = BCFTypedData.readString(bc2);
				if(!id.isEmpty() && !id.equals(VCFConstants.EMPTY_ID_FIELD)) {
					vcb.id(id);
					}

				/** ALLELES **/
				alleles=new ArrayList<>(n_allele);
				for(int i=0;i< n_allele;i++) {
					alleles.add(Allele.create(BCFTypedData.readString(bc2), i==0));
					}
				vcb.alleles(alleles);

				/** FILTERS **/
				final int[] filter_idx=BCFTypedData.readIntArray(bc2);
				if(filter_idx.length==1 && filter_idx[0]==0/* PASS is always Oth item */ ) {
					vcb.passFilters();
					}
				else if(filter_idx.length>0) {
					final Set<String> filters = new LinkedHashSet<>(filter_idx.length);
					for(int idx: filter_idx) filters.add(word(idx));
					vcb.filters(filters);
					}

				/** INFO */
				for(int i=0;i< n_info;++i) {
					final String tag=word(BCFTypedData.read(bc2).intValue());
					final BCFTypedData td=BCFTypedData.read(bc2);
					final VCFInfoHeaderLine hl = this.header.getInfoHeaderLine(tag);
					Object value= td.getValue();
					if(value==null || (hl!=null && hl.getType()==VCFHeaderLineType.Flag)) value=Boolean.TRUE;
					vcb.attribute(tag, value);
					}
				}

			if(this.header.getNGenotypeSamples()==0 || format_length==0) {
				this.input.skipNBytes(format_length);
				}
			else
				{
				fillBuffer(binaryCodec1,format_length);
				try(ByteArrayInputStream is=new ByteArrayInputStream(this.buffer,0,format_length)) {
					vcb.genotypes(decodeGenotypes(new BinaryCodec(is), n_fmt, alleles));
					}
				}
			return vcb.make();
			}
		catch(final RuntimeEOFException err) {
			throw new IOException("truncated BCF record in "+this.path, err);
			}
		}

	private List<Genotype> decodeGenotypes(final BinaryCodec bc2,final int n_fmt,final List<Allele> alleles) throws IOException {
		final List<String> samples = this.header.getGenotypeSamples();
		final List<GenotypeBuilder> builders = samples.stream().
				map(S->new GenotypeBuilder(S)).
				collect(Collectors.toList());
		for(int i=0;i< n_fmt;i++) {
			final String tag = word(BCFTypedData.read(bc2).intValue());
			final byte b= bc2.readByte();
			final BCFTypedData.Type type = BCFTypedData.decodeType(b);
			final int n_element= BCFTypedData.decodeCount(bc2,b);
			for(int x=0;x< samples.size();++x) {
				final GenotypeBuilder gb=builders.get(x);
				if(type==BCFTypedData.Type.CHAR) {
					final String s=BCFTypedData.readString(bc2,n_element);
					if(tag.equals(VCFConstants.GENOTYPE_FILTER_KEY)) {
						if(s.isEmpty() || s.equals(VCFConstants.UNFILTERED)) {
							gb.unfiltered();
							}
						else
							{
							gb.filter(s);
							}
						}
					else if(!s.isEmpty()) {
						gb.attribute(tag, s);
						}
					continue;
					}
				final List<Object> values= new ArrayList<>(n_element);
				boolean end=false;
				for(int j=0;j< n_element;++j) {
					final Object o = BCFTypedData.readAtomic(bc2,type);
					if(o==BCFTypedData.END_OF_VECTOR) end=true;
					if(!end) values.add(o);
					}
				if(tag.equals(VCFConstants.GENOTYPE_KEY)) {
					final List<Allele> gt_alleles=new ArrayList<>(values.size());
					boolean phased=false;
					for(int j=0;j< values.size();++j) {
						final Object o = values.get(j);
						if(o==null) {
							gt_alleles.add(Allele.NO_CALL);
							continue;
							}
						final int v= Integer.class.cast(o);
						final int allele_idx=((v>>1)-1);
						// the phasing of the first allele is meaningless
						if(j>0 && (v & 0x01) == 1) phased = true;
						if(allele_idx>=alleles.size()) throw new IOException("bad allele index "+allele_idx+" in "+this.path);
						gt_alleles.add(allele_idx<0?Allele.NO_CALL:alleles.get(allele_idx));
						}
					if(!gt_alleles.isEmpty()) {
						gb.alleles(gt_alleles);
						gb.phased(phased);
						}
					continue;
					}
				final List<Object> defined = values.stream().filter(O->O!=null).collect(Collectors.toList());
				if(defined.isEmpty()) continue;
				if(tag.equals(VCFConstants.GENOTYPE_QUALITY_KEY) && defined.size()==1 && type!=BCFTypedData.Type.FLOAT) {
					gb.GQ(Integer.class.cast(defined.get(0)));
					}
				else if(tag.equals(VCFConstants.DEPTH_KEY) && defined.size()==1 && type!=BCFTypedData.Type.FLOAT) {
					gb.DP(Integer.class.cast(defined.get(0)));
					}
				else if(tag.equals(VCFConstants.GENOTYPE_ALLELE_DEPTHS) && defined.size()==values.size() && type!=BCFTypedData.Type.FLOAT) {
					gb.AD(defined.stream().mapToInt(O->Integer.class.cast(O).intValue()).toArray());
					}
				else if(tag.equals(VCFConstants.GENOTYPE_PL_KEY) && defined.size()==values.size() && type!=BCFTypedData.Type.FLOAT) {
					gb.PL(defined.stream().mapToInt(O->Integer.class.cast(O).intValue()).toArray());
					}
				else
					{
					gb.attribute(tag, values.size()==1?values.get(0):values);
					}
				}
			}
		return builders.stream().map(GB->GB.make()).collect(Collectors.toList());
		}

	private static int uint32ToInt(long v) {
		if(v<0L || v > Integer.MAX_VALUE) throw new IllegalArgumentException("bad unsigned int32 "+v);
		return (int)v;
		}

	@Override
	public void close() throws IOException {
		this.input.close();
		}
}
