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
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * An in-memory overlap index of closed intervals on named chromosomes, each interval
 * carrying an int payload.
 *
 * The intervals are sorted by (chromosome, start) and each chromosome block is seen as
 * an implicit balanced binary tree where the node at index <code>i</code> has a level
 * equal to the number of trailing '1' bits of <code>i</code>. Every node stores the
 * largest end of its sub-tree.
 *
 * The index has two states: intervals are added while <code>BUILDING</code>, then
 * {@link #finalizeIndex()} sorts them and computes the augmented ends. Queries are only
 * allowed once <code>FINALIZED</code>, insertions only before.
 *
 * @author Pierre Lindenbaum
 */
public class PointIntervalIndex {
	/** the states of the index */
	public enum State {BUILDING, FINALIZED}

	private State state = State.BUILDING;
	private final Object2IntOpenHashMap<String> contig2id = new Object2IntOpenHashMap<>();
	private final List<String> contigs = new ArrayList<>();
	/* used while BUILDING */
	private IntArrayList buildContigs = new IntArrayList();
	private LongArrayList buildStarts = new LongArrayList();
	private LongArrayList buildEnds = new LongArrayList();
	private IntArrayList buildPayloads = new IntArrayList();
	/* used once FINALIZED */
	private long[] starts;
	private long[] ends;
	private long[] maxEnds;
	private int[] payloads;
	/* chromosome blocks, indexed by contig id */
	private int[] blockOffsets;
	private int[] blockSizes;
	private int[] blockRootLevels;

	public PointIntervalIndex() {
		this.contig2id.defaultReturnValue(-1);
		}

	public State getState() {
		return this.state;
		}

	public boolean isFinalized() {
		return this.state.equals(State.FINALIZED);
		}

	private void checkState(final State expect) {
		if(!this.state.equals(expect)) {
			throw new IllegalStateException("interval index is "+this.state+" but "+expect+" was expected");
			}
		}

	/** add a zero-length interval */
	public void addPoint(final String contig,final long pos,final int payload) {
		add(contig, pos, pos, payload);
		}

	/**
	 * add the closed interval [start,end]
	 * @throws IllegalStateException if the index was finalized
	 */
	public void add(final String contig,final long start,final long end,final int payload) {
		checkState(State.BUILDING);
		if(contig==null) throw new IllegalArgumentException("contig is null");
		if(end < start) throw new IllegalArgumentException("end<start : "+contig+":"+start+"-"+end);
		int tid = this.contig2id.getInt(contig);
		if(tid==-1) {
			tid = this.contigs.size();
			this.contigs.add(contig);
			this.contig2id.put(contig, tid);
			}
		this.buildContigs.add(tid);
		this.buildStarts.add(start);
		this.buildEnds.add(end);
		this.buildPayloads.add(payload);
		}

	/** @return the number of intervals */
	public int size() {
		return isFinalized() ? this.starts.length : this.buildStarts.size();
		}

	/**
	 * sort the intervals and build the augmented tree. Must be called once, after the last insertion.
	 * @throws IllegalStateException if the index was already finalized
	 */
	public void finalizeIndex() {
		checkState(State.BUILDING);
		final int n = this.buildStarts.size();
		final int[] tids = this.buildContigs.toIntArray();
		final long[] st = this.buildStarts.toLongArray();
		final long[] en = this.buildEnds.toLongArray();
		final int[] pl = this.buildPayloads.toIntArray();
		this.buildContigs = null;
		this.buildStarts = null;
		this.buildEnds = null;
		this.buildPayloads = null;

		final int[] perm = new int[n];
		for(int i=0;i< n;i++) perm[i]=i;
		IntArrays.quickSort(perm, (a,b)->{
			int d = Integer.compare(tids[a], tids[b]);
			if(d!=0) return d;
			d = Long.compare(st[a], st[b]);
			if(d!=0) return d;
			d = Long.compare(en[a], en[b]);
			if(d!=0) return d;
			return Integer.compare(pl[a], pl[b]);
			});

		this.starts = new long[n];
		this.ends = new long[n];
		this.payloads = new int[n];
		for(int i=0;i< n;i++) {
			this.starts[i] = st[perm[i]];
			this.ends[i] = en[perm[i]];
			this.payloads[i] = pl[perm[i]];
			}

		final int nContigs = this.contigs.size();
		this.blockOffsets = new int[nContigs];
		this.blockSizes = new int[nContigs];
		this.blockRootLevels = new int[nContigs];
		this.maxEnds = new long[n];
		int i = 0;
		while(i < n) {
			final int tid = tids[perm[i]];
			int j = i + 1;
			while(j < n && tids[perm[j]]==tid) j++;
			this.blockOffsets[tid] = i;
			this.blockSizes[tid] = j - i;
			this.blockRootLevels[tid] = indexBlock(i, j - i);
			i = j;
			}
		this.state = State.FINALIZED;
		}

	/** fill maxEnds for the block [off,off+n), returns the level of the root */
	private int indexBlock(final int off,final int n) {
		// max end of the suffix [i,n), for the nodes whose right child is past the end
		final long[] suffixMax = new long[n + 1];
		suffixMax[n] = Long.MIN_VALUE;
		for(int i=n-1;i>=0;i--) {
			suffixMax[i] = Math.max(this.ends[off+i], suffixMax[i+1]);
			}
		for(int i=0;i< n;i+=2) {
			this.maxEnds[off+i] = this.ends[off+i];
			}
		int k;
		for(k=1; (1L<<k) <= n; ++k) {
			final long x = 1L << (k-1);
			final long i0 = (x << 1) - 1;
			final long step = x << 2;
			for(long i=i0; i < n; i+= step) {
				final long el = this.maxEnds[off + (int)(i - x)];
				final long er = (i + x < n ? this.maxEnds[off + (int)(i + x)] : suffixMax[(int)i + 1]);
				long e = this.ends[off + (int)i];
				e = Math.max(e, el);
				e = Math.max(e, er);
				this.maxEnds[off + (int)i] = e;
				}
			}
		return k - 1;
		}

	/**
	 * find the intervals overlapping [start,end], bounds included.
	 * @return the payloads of the overlapping intervals, sorted on (start,end,payload).
	 *   An empty array if the contig is unknown or start&gt;end.
	 * @throws IllegalStateException if the index was not finalized
	 */
	public int[] overlap(final String contig,final long start,final long end) {
		checkState(State.FINALIZED);
		final IntArrayList hits = new IntArrayList();
		final int tid = this.contig2id.getInt(contig);
		if(tid==-1 || start > end) return hits.toIntArray();
		final int off = this.blockOffsets[tid];
		final long n = this.blockSizes[tid];
		if(n==0) return hits.toIntArray();

		final int[] stackLevel = new int[64];
		final long[] stackNode = new long[64];
		final boolean[] stackVisited = new boolean[64];
		int t = 0;
		stackLevel[t] = this.blockRootLevels[tid];
		stackNode[t] = (1L << stackLevel[t]) - 1;
		stackVisited[t] = false;
		t++;
		while(t > 0) {
			--t;
			final int k = stackLevel[t];
			final long x = stackNode[t];
			final boolean visited = stackVisited[t];
			if(k <= 3) {
				// small sub-tree: linear scan
				final long i0 = (x >> k) << k;
				long i1 = i0 + (1L << (k+1)) - 1;
				if(i1 > n) i1 = n;
				for(long i=i0; i < i1 && this.starts[off+(int)i] <= end; ++i) {
					if(start <= this.ends[off+(int)i]) hits.add(this.payloads[off+(int)i]);
					}
				}
			else if(!visited) {
				final long y = x - (1L << (k-1));
				stackLevel[t] = k;
				stackNode[t] = x;
				stackVisited[t] = true;
				t++;
				if(y >= n || this.maxEnds[off+(int)y] >= start) {
					stackLevel[t] = k - 1;
					stackNode[t] = y;
					stackVisited[t] = false;
					t++;
					}
				}
			else if(x < n && this.starts[off+(int)x] <= end) {
				if(start <= this.ends[off+(int)x]) hits.add(this.payloads[off+(int)x]);
				stackLevel[t] = k - 1;
				stackNode[t] = x + (1L << (k-1));
				stackVisited[t] = false;
				t++;
				}
			}
		return hits.toIntArray();
		}

	/** @return an estimation of the memory used by this index, in bytes */
	public long estimateMemoryUsage() {
		long n = 0L;
		if(isFinalized()) {
			n += (long)this.starts.length * (Long.BYTES * 3 + Integer.BYTES);
			n += (long)this.blockOffsets.length * Integer.BYTES * 3;
			}
		else
			{
			n += (long)this.buildStarts.size() * (Long.BYTES * 2 + Integer.BYTES * 2);
			}
		for(final String s: this.contigs) {
			n += s.length() * 2L + Integer.BYTES * 2;
			}
		return n;
		}
}
