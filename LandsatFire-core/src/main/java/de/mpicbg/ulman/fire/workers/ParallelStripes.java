/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.workers;

import java.util.List;
import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ExecutionException;

/**
 * Splits the range [0,length) into contiguous stripes and processes them
 * concurrently, one stripe per task. Jobs must write only into the region
 * of their own stripe.
 */
class ParallelStripes
{
	interface StripeJob
	{
		///processes the half-open range [from,to)
		void process(final int from, final int to);
	}

	static
	void run(final int length, final int noOfThreads, final StripeJob job)
	{
		if (length <= 0) return;

		final int noOfStripes = Math.max(1, Math.min(noOfThreads, length));
		if (noOfStripes == 1)
		{
			//no need to bother with threads at all
			job.process(0, length);
			return;
		}

		final ExecutorService pool = Executors.newFixedThreadPool(noOfStripes);
		try {
			final List<Future<?>> tasks = new ArrayList<>(noOfStripes);
			for (int s=0; s < noOfStripes; ++s)
			{
				final int from = (int)((long)length * s / noOfStripes);
				final int to   = (int)((long)length * (s+1) / noOfStripes);
				tasks.add( pool.submit(() -> job.process(from,to)) );
			}

			for (Future<?> t : tasks)
				t.get();
		}
		catch (ExecutionException e) {
			final Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) throw (RuntimeException)cause;
			if (cause instanceof Error) throw (Error)cause;
			throw new IllegalStateException("Worker thread failed: "+cause.getMessage(), cause);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for worker threads.", e);
		}
		finally {
			pool.shutdownNow();
		}
	}
}
