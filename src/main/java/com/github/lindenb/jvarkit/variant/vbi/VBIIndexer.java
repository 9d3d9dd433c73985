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

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.github.lindenb.jvarkit.variant.vbi.io.VariantSource;
import com.github.lindenb.jvarkit.variant.vbi.io.VariantSources;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import htsjdk.variant.variantcontext.VariantContext;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Builds a VBI index with a single pass over a sorted VCF or BCF file.
 * The position of the reader is recorded just before each record is read.
 *
 * <pre>
 * Path vbi = VBIIndexer.index(Paths.get("in.vcf.gz"), null, 1);
 * </pre>
 * @author Pierre Lindenbaum
 */
public class VBIIndexer {
	private static final Log LOG=Log.getInstance(VBIIndexer.class);
	/** suffix of the index file */
	public static final String SUFFIX = ".vbi";
	private int threads = 1;

	public VBIIndexer() {
		}

	/** decompression threads hint. Does not change the content of the index. */
	public VBIIndexer setThreads(final int threads) {
		this.threads = Math.max(1, threads);
		return this;
		}

	public int getThreads() {
		return this.threads;
		}

	/** @return the default index path for a VCF: &lt;source&gt;.vbi */
	public static Path getDefaultIndexPath(final Path source) {
		return source.resolveSibling(source.getFileName().toString() + SUFFIX);
		}

	/**
	 * index a VCF or a BCF
	 * @param source the VCF or BCF
	 * @param index the output, if null {@link #getDefaultIndexPath(Path)} is used
	 * @param threads decompression threads hint
	 * @return the path of the index
	 * @throws IOException if the source cannot be read or the index cannot be written
	 */
	public static Path index(final Path source,final Path index,final int threads) throws IOException {
		return new VBIIndexer().setThreads(threads).index(source, index);
		}

	/**
	 * index a VCF or a BCF
	 * @param source the VCF or BCF
	 * @param index the output, if null {@link #getDefaultIndexPath(Path)} is used
	 * @return the path of the index
	 * @throws IOException if the source cannot be read or the index cannot be written
	 */
	public Path index(final Path source,final Path index) throws IOException {
		if(source==null) throw new IllegalArgumentException("source is null");
		final Path dest = (index==null ? getDefaultIndexPath(source) : index);
		final VBIIndexCodec.Content content;
		try(VariantSource src = VariantSources.open(source, this.threads)) {
			content = scan(src);
			}
		write(content, dest);
		LOG.info("Indexed "+source+": "+
				content.getSampleCount()+" samples, "+
				content.getMarkerCount()+" markers, "+
				content.getChromosomes().size()+" chromosomes. Saved as "+dest);
		return dest;
		}

	/**
	 * read all the records of an opened source.
	 * @param src the source, positioned just after the header
	 * @return the content of the index
	 */
	public VBIIndexCodec.Content scan(final VariantSource src) throws IOException {
		final long sampleCount = src.getHeader().getNGenotypeSamples();
		final List<String> chromosomes = new ArrayList<>();
		final Object2IntOpenHashMap<String> chrom2id = new Object2IntOpenHashMap<>();
		chrom2id.defaultReturnValue(-1);
		final IntArrayList chromIds = new IntArrayList();
		final LongArrayList positions = new LongArrayList();
		final LongArrayList offsets = new LongArrayList();
		final ProgressLogger progress = new ProgressLogger(LOG, 1_000_000, "Indexed", "variants");

		for(;;) {
			final long offset = src.getPosition();
			final VariantContext ctx = src.next();
			if(ctx==null) break;
			if(chromIds.size() >= VBIIndexCodec.MAX_MARKERS) {
				throw new IOException("too many records in "+src.getPath());
				}
			final String contig = ctx.getContig();
			int tid = chrom2id.getInt(contig);
			if(tid==-1) {
				tid = chromosomes.size();
				chromosomes.add(contig);
				chrom2id.put(contig, tid);
				LOG.debug("new chromosome "+contig+" at marker #"+(chromIds.size()+1));
				}
			chromIds.add(tid);
			positions.add(ctx.getStart());
			offsets.add(offset);
			progress.record(contig, ctx.getStart());
			}
		return new VBIIndexCodec.Content(sampleCount, chromosomes, chromIds.toIntArray(), positions.toLongArray(), offsets.toLongArray());
		}

	/**
	 * write into a temporary file of the destination directory, then rename it.
	 * The temporary file gets the default permissions of a new file.
	 */
	static void write(final VBIIndexCodec.Content content,final Path dest) throws IOException {
		final Path dir = dest.toAbsolutePath().getParent();
		final Path tmp = dir.resolve("tmp."+UUID.randomUUID()+SUFFIX);
		boolean done = false;
		try {
			try(OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))) {
				VBIIndexCodec.encode(out, content);
				}
			try {
				Files.move(tmp, dest, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
				}
			catch(final AtomicMoveNotSupportedException err) {
				LOG.debug("atomic move not supported, replacing "+dest);
				Files.move(tmp, dest, StandardCopyOption.REPLACE_EXISTING);
				}
			done = true;
			}
		finally {
			if(!done) Files.deleteIfExists(tmp);
			}
		}
}
