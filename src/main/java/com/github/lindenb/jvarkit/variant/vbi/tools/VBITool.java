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
package com.github.lindenb.jvarkit.variant.vbi.tools;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.github.lindenb.jvarkit.variant.vbi.VBIIndex;
import com.github.lindenb.jvarkit.variant.vbi.VBIIndexer;
import com.github.lindenb.jvarkit.variant.vbi.VBIMemoryUsage;
import com.github.lindenb.jvarkit.variant.vbi.VBIRecordMaterializer;
import com.github.lindenb.jvarkit.variant.vbi.VBIRegionException;
import com.github.lindenb.jvarkit.variant.vbi.io.SourceCodec;
import com.github.lindenb.jvarkit.variant.vbi.io.VariantSource;
import com.github.lindenb.jvarkit.variant.vbi.io.VariantSources;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.writer.VariantContextWriter;
import htsjdk.variant.variantcontext.writer.VariantContextWriterBuilder;
import htsjdk.variant.vcf.VCFHeader;

/**
 * Command line interface for VBI indexes.
 * <pre>
 * java -jar vbi.jar index in.vcf.gz
 * java -jar vbi.jar query --vbi in.vcf.gz.vbi in.vcf.gz "chr1:100-200,chr2"
 * java -jar vbi.jar range --vbi in.vcf.gz.vbi in.vcf.gz 1 10
 * java -jar vbi.jar print --vbi in.vcf.gz.vbi -n 10
 * java -jar vbi.jar stats --vbi in.vcf.gz.vbi
 * </pre>
 * @author Pierre Lindenbaum
 */
public class VBITool {
	private static final Log LOG=Log.getInstance(VBITool.class);

	@Parameter(names={"-h","--help"}, description="print help and exit", help=true)
	private boolean help = false;
	@Parameter(names={"--verbosity"}, description="log level: ERROR, WARNING, INFO, DEBUG")
	private Log.LogLevel verbosity = Log.LogLevel.INFO;

	@Parameters(commandDescription="Build the VBI index of a VCF or BCF file.")
	static class IndexCommand {
		@Parameter(names={"--threads"}, description="decompression threads")
		int threads = 1;
		@Parameter(description="<in.vcf|in.vcf.gz|in.bcf> [out.vbi]")
		List<String> args = new ArrayList<>();
		}

	@Parameters(commandDescription="Print the records of one or more regions as VCF.")
	static class QueryCommand {
		@Parameter(names={"--vbi"}, description="VBI index", required=true)
		String vbi = null;
		@Parameter(names={"--linear"}, description="scan all the markers instead of using the interval index")
		boolean linear = false;
		@Parameter(names={"--threads"}, description="decompression threads")
		int threads = 1;
		@Parameter(description="<in.vcf|in.vcf.gz|in.bcf> <regions>")
		List<String> args = new ArrayList<>();
		}

	@Parameters(commandDescription="Print the records between two 1-based indexes as VCF.")
	static class RangeCommand {
		@Parameter(names={"--vbi"}, description="VBI index", required=true)
		String vbi = null;
		@Parameter(names={"--threads"}, description="decompression threads")
		int threads = 1;
		@Parameter(description="<in.vcf|in.vcf.gz|in.bcf> <start> <end>")
		List<String> args = new ArrayList<>();
		}

	@Parameters(commandDescription="Print the first markers of a VBI index.")
	static class PrintCommand {
		@Parameter(names={"--vbi"}, description="VBI index", required=true)
		String vbi = null;
		@Parameter(names={"-n"}, description="number of markers, all if <=0")
		int n = 10;
		@Parameter(description="[in.vcf|in.vcf.gz|in.bcf] : if set, the offsets are described using the codec of this file")
		List<String> args = new ArrayList<>();
		}

	@Parameters(commandDescription="Print the counts and the memory usage of a VBI index.")
	static class StatsCommand {
		@Parameter(names={"--vbi"}, description="VBI index", required=true)
		String vbi = null;
		}

	/**
	 * run the tool
	 * @param args command line
	 * @param out where the results are written
	 * @return 0 on success
	 */
	public int instanceMain(final String[] args,final PrintStream out) {
		final IndexCommand indexCmd = new IndexCommand();
		final QueryCommand queryCmd = new QueryCommand();
		final RangeCommand rangeCmd = new RangeCommand();
		final PrintCommand printCmd = new PrintCommand();
		final StatsCommand statsCmd = new StatsCommand();
		final JCommander jc = JCommander.newBuilder().
				programName("vbi").
				addObject(this).
				addCommand("index", indexCmd).
				addCommand("query", queryCmd).
				addCommand("range", rangeCmd).
				addCommand("print", printCmd).
				addCommand("stats", statsCmd).
				build();
		try {
			jc.parse(args);
			}
		catch(final ParameterException err) {
			LOG.error(err.getMessage());
			usage(jc);
			return -1;
			}
		if(this.help || jc.getParsedCommand()==null) {
			usage(jc);
			return this.help ? 0 : -1;
			}
		Log.setGlobalLogLevel(this.verbosity);
		try {
			switch(jc.getParsedCommand()) {
				case "index": return doIndex(indexCmd);
				case "query": return doQuery(queryCmd, out);
				case "range": return doRange(rangeCmd, out);
				case "print": return doPrint(printCmd, out);
				case "stats": return doStats(statsCmd, out);
				default: throw new IllegalStateException(jc.getParsedCommand());
				}
			}
		catch(final BadArgumentException err) {
			LOG.error(err.getMessage());
			usage(jc);
			return -1;
			}
		catch(final VBIRegionException err) {
			LOG.error(err.getMessage());
			return -1;
			}
		catch(final IOException err) {
			LOG.error(err);
			return -1;
			}
		catch(final RuntimeIOException|IllegalArgumentException|IllegalStateException err) {
			LOG.error(err);
			return -1;
			}
		}

	private static class BadArgumentException extends RuntimeException {
		private static final long serialVersionUID = 1L;
		BadArgumentException(final String msg) {
			super(msg);
			}
		}

	private void usage(final JCommander jc) {
		final StringBuilder sb = new StringBuilder();
		jc.getUsageFormatter().usage(sb);
		System.err.println(sb);
		}

	private int doIndex(final IndexCommand cmd) throws IOException {
		if(cmd.args.isEmpty() || cmd.args.size()>2) throw new BadArgumentException("index: expected <in> [out]");
		final Path in = Paths.get(cmd.args.get(0));
		final Path out = cmd.args.size()==2 ? Paths.get(cmd.args.get(1)) : null;
		VBIIndexer.index(in, out, cmd.threads);
		return 0;
		}

	private int doQuery(final QueryCommand cmd,final PrintStream out) throws IOException {
		if(cmd.args.size()!=2) throw new BadArgumentException("query: expected <in> <regions>");
		final Path in = Paths.get(cmd.args.get(0));
		try(VBIIndex index = VBIIndex.load(Paths.get(cmd.vbi))) {
			final int[] ordinals = cmd.linear ?
					index.queryRegion(cmd.args.get(1)) :
					index.queryRegionIndexed(cmd.args.get(1));
			LOG.info(ordinals.length+" record(s) in "+cmd.args.get(1));
			writeVcf(in, index, ordinals, cmd.threads, out);
			}
		return 0;
		}

	private int doRange(final RangeCommand cmd,final PrintStream out) throws IOException {
		if(cmd.args.size()!=3) throw new BadArgumentException("range: expected <in> <start> <end>");
		final Path in = Paths.get(cmd.args.get(0));
		final long start;
		final long end;
		try {
			start = Long.parseLong(cmd.args.get(1));
			end = Long.parseLong(cmd.args.get(2));
			}
		catch(final NumberFormatException err) {
			throw new BadArgumentException("range: bad index "+err.getMessage());
			}
		try(VBIIndex index = VBIIndex.load(Paths.get(cmd.vbi))) {
			writeVcf(in, index, index.queryIndexRange(start, end), cmd.threads, out);
			}
		return 0;
		}

	private int doPrint(final PrintCommand cmd,final PrintStream out) throws IOException {
		if(cmd.args.size()>1) throw new BadArgumentException("print: expected at most one source file");
		SourceCodec codec = null;
		if(!cmd.args.isEmpty()) {
			try(VariantSource src = VariantSources.open(Paths.get(cmd.args.get(0)), 1)) {
				codec = src.getCodec();
				}
			}
		try(VBIIndex index = VBIIndex.load(Paths.get(cmd.vbi))) {
			index.print(out, cmd.n, codec);
			}
		return 0;
		}

	private int doStats(final StatsCommand cmd,final PrintStream out) throws IOException {
		try(VBIIndex index = VBIIndex.load(Paths.get(cmd.vbi))) {
			final VBIMemoryUsage mem = index.memoryUsage();
			out.println("samples\t"+index.getSampleCount());
			out.println("markers\t"+index.getMarkerCount());
			out.println("chromosomes\t"+index.getChromosomes().size());
			out.println("index_bytes\t"+mem.getIndexBytes());
			out.println("interval_index_bytes\t"+mem.getIntervalIndexBytes());
			out.flush();
			}
		return 0;
		}

	/** write the header of the source and the records at the ordinals */
	private void writeVcf(final Path in,final VBIIndex index,final int[] ordinals,final int threads,final OutputStream out) throws IOException {
		final VCFHeader header;
		try(VariantSource src = VariantSources.open(in, threads)) {
			header = src.getHeader();
			}
		final List<VariantContext> variants = new VBIRecordMaterializer().
				setThreads(threads).
				fetchVariants(in, index, ordinals);
		final VariantContextWriter w = new VariantContextWriterBuilder().
				setOutputStream(new NonClosingOutputStream(out)).
				clearOptions().
				build();
		try {
			w.writeHeader(header);
			for(final VariantContext ctx: variants) {
				if(ctx!=null) w.add(ctx);
				}
			}
		finally {
			w.close();
			}
		out.flush();
		}

	/** the writer closes its stream, the caller owns it */
	private static class NonClosingOutputStream extends FilterOutputStream {
		NonClosingOutputStream(final OutputStream delegate) {
			super(delegate);
			}
		@Override
		public void write(final byte[] b,final int off,final int len) throws IOException {
			this.out.write(b, off, len);
			}
		@Override
		public void close() throws IOException {
			flush();
			}
		}

	public static void main(final String[] args) {
		final int ret = new VBITool().instanceMain(args, System.out);
		System.out.flush();
		System.exit(ret);
		}
}
