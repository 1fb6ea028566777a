/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.util;

/**
 * Run configuration of the fire detection. Instances are immutable,
 * use the {@link Builder} to obtain one. The window size is checked
 * already when building; whether it fits the images can only be
 * checked once the images are known, see {@link #validateFor(long, long)}.
 */
public final class FireConfig
{
	public static final int DEFAULT_WINDOW_SIZE = 61;
	public static final int DEFAULT_EDGE_BORDER_WIDTH = 30;

	///side length of the moving window, odd
	public final int windowSize;
	///if the outer border of the classification should be forced to background
	public final boolean maskEdges;
	///width of the forced border, in pixels
	public final int edgeBorderWidth;
	///if the classification should be persisted also as a raster (not only as vectors)
	public final boolean emitRaster;
	///if the per-test masks should be persisted as rasters too
	public final boolean emitDiagnostics;
	///how many worker threads to use
	public final int noOfThreads;

	private FireConfig(final Builder b)
	{
		windowSize = b.windowSize;
		maskEdges = b.maskEdges;
		edgeBorderWidth = b.edgeBorderWidth;
		emitRaster = b.emitRaster;
		emitDiagnostics = b.emitDiagnostics;
		noOfThreads = b.noOfThreads;
	}

	///a configuration with all options at their defaults
	public static
	FireConfig defaults()
	{
		return new Builder().build();
	}

	public static
	Builder builder()
	{
		return new Builder();
	}

	///a builder pre-filled with the options of this configuration
	public Builder toBuilder()
	{
		return new Builder()
			.windowSize(windowSize)
			.maskEdges(maskEdges)
			.edgeBorderWidth(edgeBorderWidth)
			.emitRaster(emitRaster)
			.emitDiagnostics(emitDiagnostics)
			.threads(noOfThreads);
	}

	/**
	 * Throws InvalidWindowSizeException if the window does not fit
	 * into an image of the given size.
	 */
	public void validateFor(final long width, final long height)
	{
		if (windowSize > width || windowSize > height)
			throw new InvalidWindowSizeException("Window size "+windowSize
				+" exceeds the image size "+width+" x "+height+".");
	}

	@Override
	public String toString()
	{
		return "window_size="+windowSize
		    +", mask_edges="+maskEdges
		    +", edge_border_width="+edgeBorderWidth
		    +", emit_raster="+emitRaster
		    +", emit_diagnostics="+emitDiagnostics
		    +", threads="+noOfThreads;
	}


	public static final class Builder
	{
		private int windowSize = DEFAULT_WINDOW_SIZE;
		private boolean maskEdges = true;
		private int edgeBorderWidth = DEFAULT_EDGE_BORDER_WIDTH;
		private boolean emitRaster = false;
		private boolean emitDiagnostics = false;
		private int noOfThreads = Runtime.getRuntime().availableProcessors();

		private Builder()
		{}

		public Builder windowSize(final int ws)
		{ windowSize = ws; return this; }

		public Builder maskEdges(final boolean b)
		{ maskEdges = b; return this; }

		public Builder edgeBorderWidth(final int w)
		{ edgeBorderWidth = w; return this; }

		public Builder emitRaster(final boolean b)
		{ emitRaster = b; return this; }

		public Builder emitDiagnostics(final boolean b)
		{ emitDiagnostics = b; return this; }

		public Builder threads(final int n)
		{ noOfThreads = n; return this; }

		public FireConfig build()
		{
			if (windowSize <= 0)
				throw new InvalidWindowSizeException("Window size must be positive, got "+windowSize+".");
			if ((windowSize & 1) == 0)
				throw new InvalidWindowSizeException("Window size must be odd, got "+windowSize+".");
			if (edgeBorderWidth < 0)
				throw new IllegalArgumentException("Edge border width must not be negative, got "+edgeBorderWidth+".");
			if (noOfThreads < 1)
				throw new IllegalArgumentException("At least one worker thread is required, got "+noOfThreads+".");

			return new FireConfig(this);
		}
	}
}
