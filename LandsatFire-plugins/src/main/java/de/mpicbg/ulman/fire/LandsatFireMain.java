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

import org.scijava.Context;
import org.scijava.log.LogService;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.List;

import de.mpicbg.ulman.fire.io.FolderBandSource;
import de.mpicbg.ulman.fire.util.FireConfig;
import de.mpicbg.ulman.fire.util.KeyValueArgs;
import de.mpicbg.ulman.fire.workers.SceneWorker;

public class LandsatFireMain
{
	static void printUsage(final LogService log)
	{
		log.info("Usage: [key=value ...] bandFile1 ... bandFile7   (or a folder with them)");
		log.info("Keys: window_size=61 mask_edges=true edge_border_width=30 emit_raster=false");
		log.info("      emit_diagnostics=false (alias writevals) threads=N output=folder");
		log.info("Band files must be named *_B1.* to *_B7.* and hold TOA reflectance.");
	}

	/** Returns the process exit status: 0 on success, 1 on any failure. */
	static int run(final LogService log, final String... args)
	{
		try {
			final KeyValueArgs kv = new KeyValueArgs(args);
			final FireConfig config = kv.toConfig(FireConfig.defaults());

			List<File> files = kv.files();
			if (files.isEmpty())
			{
				printUsage(log);
				log.error("No band files given.");
				return 1;
			}
			if (files.size() == 1 && files.get(0).isDirectory())
				files = FolderBandSource.filesOf(files.get(0));

			new SceneWorker(log).process(new FolderBandSource(log, files), config, kv.output());
			return 0;
		}
		catch (ParseException e) {
			printUsage(log);
			log.error("LandsatFire arguments problem: "+e.getMessage());
		}
		catch (RuntimeException e) {
			log.error("LandsatFire problem: "+e.getMessage());
		}
		catch (IOException e) {
			log.error("LandsatFire error: "+e.getMessage());
		}
		return 1;
	}

	//the CLI path entry function:
	public static void main(final String... args)
	{
		//head less variant, only the log service is needed
		final Context context = new Context(LogService.class);
		final int status = run(context.getService(LogService.class), args);
		context.dispose();

		System.exit(status);
	}
}
