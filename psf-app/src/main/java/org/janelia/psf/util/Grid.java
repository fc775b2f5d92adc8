/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.psf.util;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.n5.DataBlock;

import net.imglib2.Interval;

/**
 * Block layout of a chunked n-dimensional dataset.  Dimension 0 varies fastest,
 * matching the n5 convention, so a dataset with dimensions {nx, ny, nz} maps to a
 * flat array index of x + nx * (y + ny * z).
 *
 * @author Stephan Saalfeld &lt;saalfelds@janelia.hhmi.org&gt;
 */
public class Grid {

	private Grid() {}

	/**
	 * Crops the dimensions of a {@link DataBlock} at a given offset to fit
	 * into an {@link Interval} of given dimensions and calculates the grid
	 * position of the block.
	 */
	static void cropBlockDimensions(
			final long[] dimensions,
			final long[] offset,
			final int[] blockSize,
			final long[] croppedBlockSize,
			final long[] gridPosition) {

		for (int d = 0; d < dimensions.length; ++d) {
			croppedBlockSize[d] = Math.min(blockSize[d], dimensions[d] - offset[d]);
			gridPosition[d] = offset[d] / blockSize[d];
		}
	}

	/**
	 * Create a {@link List} of grid blocks that, for each grid cell, contains
	 * the dataset offset, the (cropped) size of the block, and the grid
	 * position needed to read the block.
	 */
	public static List<Block> create(
			final long[] dimensions,
			final int[] blockSize) {

		final int n = dimensions.length;
		final List<Block> gridBlocks = new ArrayList<>();

		for (int d = 0; d < n; ++d) {
			if (dimensions[d] < 1)
				return gridBlocks;
		}

		final long[] offset = new long[n];
		final long[] gridPosition = new long[n];
		final long[] croppedBlockSize = new long[n];
		for (int d = 0; d < n;) {
			cropBlockDimensions(dimensions, offset, blockSize, croppedBlockSize, gridPosition);
			gridBlocks.add(new Block(croppedBlockSize, offset, gridPosition));

			for (d = 0; d < n; ++d) {
				offset[d] += blockSize[d];
				if (offset[d] < dimensions[d])
					break;
				else
					offset[d] = 0;
			}
		}
		return gridBlocks;
	}

	/**
	 * Copies the values of one block into a flat array holding the entire dataset.
	 *
	 * @param block            location of the block within the dataset.
	 * @param blockSize        size of the block data as stored (may exceed the cropped block dimensions).
	 * @param blockValues      block data with dimension 0 varying fastest.
	 * @param dimensions       dataset dimensions.
	 * @param datasetValues    flat target array for the entire dataset.
	 */
	public static void copyBlock(
			final Block block,
			final int[] blockSize,
			final double[] blockValues,
			final long[] dimensions,
			final double[] datasetValues) {

		final int n = dimensions.length;
		final long[] position = new long[n];
		final long runLength = block.dimensions[0];

		for (int d = 0; d < n;) {

			long blockIndex = 0;
			long datasetIndex = 0;
			for (int k = n - 1; k >= 0; --k) {
				blockIndex = blockIndex * blockSize[k] + position[k];
				datasetIndex = datasetIndex * dimensions[k] + block.offset[k] + position[k];
			}

			System.arraycopy(blockValues, (int) blockIndex, datasetValues, (int) datasetIndex, (int) runLength);

			// rows along dimension 0 are copied as a whole, so iteration starts with dimension 1
			for (d = 1; d < n; ++d) {
				position[d]++;
				if (position[d] < block.dimensions[d])
					break;
				else
					position[d] = 0;
			}
		}
	}

	/**
	 * Extracts the values of one (cropped) block from a flat array holding the entire dataset.
	 *
	 * @return block values with dimension 0 varying fastest.
	 */
	public static double[] extractBlock(
			final Block block,
			final double[] datasetValues,
			final long[] dimensions) {

		final int n = dimensions.length;
		final double[] blockValues = new double[(int) block.size()];
		final long[] position = new long[n];
		final int runLength = (int) block.dimensions[0];

		int blockIndex = 0;
		for (int d = 0; d < n;) {

			long datasetIndex = 0;
			for (int k = n - 1; k >= 0; --k)
				datasetIndex = datasetIndex * dimensions[k] + block.offset[k] + position[k];

			System.arraycopy(datasetValues, (int) datasetIndex, blockValues, blockIndex, runLength);
			blockIndex += runLength;

			for (d = 1; d < n; ++d) {
				position[d]++;
				if (position[d] < block.dimensions[d])
					break;
				else
					position[d] = 0;
			}
		}
		return blockValues;
	}

	public static class Block implements Serializable, Interval {
		public final long[] dimensions;
		public final long[] offset;
		public final long[] gridPosition;

		public Block(final long[] dimensions, final long[] offset, final long[] gridPosition) {
			this.dimensions = dimensions.clone();
			this.offset = offset.clone();
			this.gridPosition = gridPosition.clone();

			if (dimensions.length != offset.length || dimensions.length != gridPosition.length)
				throw new IllegalArgumentException("Dimensions of block, offset, and grid position must match.");
		}

		public long size() {
			long size = 1;
			for (final long dimension : dimensions)
				size *= dimension;
			return size;
		}

		@Override
		public long min(final int i) {
			return offset[i];
		}

		@Override
		public long max(final int i) {
			return offset[i] + dimensions[i] - 1;
		}

		@Override
		public int numDimensions() {
			return dimensions.length;
		}
	}
}
