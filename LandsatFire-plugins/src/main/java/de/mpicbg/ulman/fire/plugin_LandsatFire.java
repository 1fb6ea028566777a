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

import org.scijava.ItemIO;
import org.scijava.ItemVisibility;
import org.scijava.command.Command;
import org.scijava.command.CommandModule;
import org.scijava.command.CommandService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.log.LogService;

import org.scijava.widget.FileWidget;
import java.io.File;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import de.mpicbg.ulman.fire.io.FolderBandSource;
import de.mpicbg.ulman.fire.util.FireClass;
import de.mpicbg.ulman.fire.util.FireConfig;
import de.mpicbg.ulman.fire.util.FireMasks;
import de.mpicbg.ulman.fire.util.FireParams;
import de.mpicbg.ulman.fire.workers.SceneWorker;

@Plugin(type = Command.class, menuPath = "Plugins>Landsat>Landsat-8 Active Fire Detection",
        name = "LandsatFire", headless = true,
		  description = "Classifies pixels of a Landsat-8 OLI daytime scene into background,\n"
				+"DN folding, unambiguous fire and potential fire (Schroeder et al. 2016).\n"
				+"The folder must contain the band files *_B1.TIF to *_B7.TIF in TOA reflectance.")
public class plugin_LandsatFire implements Command
{
	//------------- GUI stuff -------------
	//
	@Parameter
	private LogService log;

	@Parameter
	private CommandService cs;

	@Parameter(label = "Path to the scene folder:",
		columns = 40, style = FileWidget.DIRECTORY_STYLE,
		description = "Path should contain band files directly: *_B1.TIF ... *_B7.TIF")
	private File scenePath;

	@Parameter(label = "Path to the output folder:",
		columns = 40, style = FileWidget.DIRECTORY_STYLE, required = false,
		description = "Leave empty to write the outputs next to the band files.")
	private File outputPath;

	@Parameter(label = "Background window size:", min = "3", stepSize = "2",
		description = "Side of the square window of the local background statistics, must be odd.")
	private int windowSize = FireConfig.DEFAULT_WINDOW_SIZE;

	@Parameter(label = "Mask image edges",
		description = "Forces background along the image border where the background window is incomplete.")
	private boolean maskEdges = true;

	@Parameter(label = "Edge border width:", min = "0")
	private int edgeBorderWidth = FireConfig.DEFAULT_EDGE_BORDER_WIDTH;


	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false,
		label = "Select optional preferences:")
	private final String optionsHeader = "";

	@Parameter(label = "Save also classification raster",
		description = "Besides the Classified_Pixels.geojson vectors, save the classes also as *_CLASS_PIX.tif.")
	private boolean emitRaster = false;

	@Parameter(label = "Save masks of the individual tests",
		description = "Saves 0/255 masks of the fire, DN folding, water and potential fire tests.")
	private boolean emitDiagnostics = false;

	@Parameter(label = "Adjust detection thresholds",
		description = "Opens another dialog with all thresholds of the algorithm.")
	private boolean adjustThresholds = false;

	@Parameter(label = "Number of threads:", min = "1")
	private int noOfThreads = Runtime.getRuntime().availableProcessors();


	//citation footer...
	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false, label = "Please, cite:")
	private final String citationFooterA
		= "Schroeder W, Oliva P, Giglio L, Quayle B, Lorenz E, Morelli F.";
	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false, label = ":")
	private final String citationFooterB
		= "Active fire detection using Landsat-8/OLI data.";
	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false, label = ":")
	private final String citationFooterC
		= "Remote Sensing of Environment. 2016. doi:10.1016/j.rse.2015.08.032";


	//hidden output values
	@Parameter(type = ItemIO.OUTPUT)
	String SCENEdir;
	@Parameter(type = ItemIO.OUTPUT)
	String sep = "--------------------";

	@Parameter(type = ItemIO.OUTPUT)
	long DNfolding = -1;
	@Parameter(type = ItemIO.OUTPUT)
	long Unambiguous = -1;
	@Parameter(type = ItemIO.OUTPUT)
	long PotentialFire = -1;


	//the GUI path entry function:
	@Override
	public void run()
	{
		SCENEdir = scenePath.getPath();

		try {
			final FireConfig config = FireConfig.builder()
				.windowSize(windowSize)
				.maskEdges(maskEdges)
				.edgeBorderWidth(edgeBorderWidth)
				.emitRaster(emitRaster)
				.emitDiagnostics(emitDiagnostics)
				.threads(noOfThreads)
				.build();

			final SceneWorker worker = new SceneWorker(log);
			if (adjustThresholds)
			{
				final FireParams thresholds
					= awaitThresholds(cs.run(LandsatFire_params.class, true), log);
				if (thresholds == null) return;
				worker.params = thresholds;
			}

			final FireMasks masks = worker.process(
				new FolderBandSource(log, FolderBandSource.filesOf(scenePath)),
				config, outputPath);

			final long[] hist = masks.classHistogram();
			DNfolding     = hist[FireClass.DN_FOLDING.value];
			Unambiguous   = hist[FireClass.UNAMBIGUOUS.value];
			PotentialFire = hist[FireClass.POTENTIAL_FIRE.value];
		}
		catch (RuntimeException e) {
			log.error("LandsatFire problem: "+e.getMessage());
		}
		catch (Exception e) {
			log.error("LandsatFire error: "+e.getMessage());
		}

		//do not report anything explicitly as ItemIO.OUTPUT will make it output automatically
	}

	///waits for the thresholds dialog, returns null if it was cancelled or interrupted
	static
	FireParams awaitThresholds(final Future<CommandModule> dialog, final LogService log)
	throws ExecutionException
	{
		try {
			final CommandModule m = dialog.get();
			if (m.isCanceled())
			{
				log.info("Threshold dialog cancelled, nothing processed.");
				return null;
			}
			return ((LandsatFire_params)m.getCommand()).toFireParams();
		}
		catch (InterruptedException e) {
			log.warn("Interrupted while waiting for the thresholds, nothing processed.");
			Thread.currentThread().interrupt();
			return null;
		}
	}
}
