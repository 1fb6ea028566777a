/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire;

import org.junit.Test;
import org.scijava.command.CommandModule;
import org.scijava.log.StderrLogService;

import java.util.concurrent.FutureTask;

import static org.junit.Assert.*;

public class plugin_LandsatFireTest
{
	@Test
	public void testInterruptedThresholdDialogKeepsTheInterruptFlag()
	throws Exception
	{
		//never run, hence get() can only wait
		final FutureTask<CommandModule> dialog = new FutureTask<>(() -> null);

		Thread.currentThread().interrupt();
		try
		{
			assertNull(plugin_LandsatFire.awaitThresholds(dialog, new StderrLogService()));
			assertTrue(Thread.currentThread().isInterrupted());
		}
		finally
		{
			//leave a clean thread for the other tests
			Thread.interrupted();
		}
	}
}
