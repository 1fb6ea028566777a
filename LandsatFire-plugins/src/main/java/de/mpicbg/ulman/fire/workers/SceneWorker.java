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

import org.scijava.log.LogService;

import org.locationtech.jts.geom.util.AffineTransformation;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import de.mpicbg.ulman.fire.io.BandSource;
import de.mpicbg.ulman.fire.io.ClassRasterWriter;
import de.mpicbg.ulman.fire.util.FireConfig;
import de.mpicbg.ulman.fire.util.FireMasks;
import de.mpicbg.ulman.fire.util.FireParams;
import de.mpicbg.ulman.fire.util.LandsatBands;
import de.mpicbg.ulman.fire.vector.ClassPolygon;
import de.mpicbg.ulman.fire.vector.ClassPolygonizer;
import de.mpicbg.ulman.fire.vector.GeoJsonFeatureWriter;

/**
 * Processes one scene end-to-end: loads the bands, detects the fires
 * and writes the outputs (vectors always, rasters on request).
 */
public class SceneWorker
{
	///shortcuts to some Fiji services
	private final LogService log;

	///a constructor requiring connection to Fiji report/log services
	public SceneWorker(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	///thresholds handed over to the FireDetector
	public FireParams params = new FireParams();

	///files written during the last process() call
	public final List<File> writtenFiles = new ArrayList<>();


	/**
	 * Outputs go into the 'outputFolder', or next to the band files
	 * if it is null. Nothing is written if the detection fails.
	 */
	public FireMasks process(final BandSource source, final FireConfig config, final File outputFolder)
	throws IOException
	{
		writtenFiles.clear();
		final long timeStart = System.currentTimeMillis();

		final LandsatBands bands = source.load();

		final FireDetector detector = new FireDetector(log);
		detector.params = params;
		final FireMasks masks = detector.calculate(bands, config);

		final File base = outputBase(source.baseName(), outputFolder);
		final File folder = base.getParentFile() != null ? base.getParentFile() : new File(".");
		if (!folder.isDirectory() && !folder.mkdirs())
			throw new IOException("Cannot create output folder: "+folder.getPath());

		final ClassRasterWriter rasterWriter = new ClassRasterWriter(log);
		if (config.emitRaster)
		{
			final String path = base.getPath()+ClassRasterWriter.CLASS_SUFFIX;
			rasterWriter.writeClasses(masks.classes, path);
			writtenFiles.add(new File(path));
		}
		if (config.emitDiagnostics)
			for (String path : rasterWriter.writeDiagnostics(masks, base.getPath()))
				writtenFiles.add(new File(path));

		final AffineTransformation transform = source.geoTransform();
		final List<ClassPolygon> polygons
			= new ClassPolygonizer(log).polygonize(masks.classes, transform);

		final File vectors = new File(folder, GeoJsonFeatureWriter.DEFAULT_FILE_NAME);
		new GeoJsonFeatureWriter(log).write(polygons, vectors);
		writtenFiles.add(vectors);

		final long timeEnd = System.currentTimeMillis();
		log.info(String.format("File processing completed. Time taken: %.2f seconds",
			(timeEnd-timeStart)/1000.0));

		return masks;
	}

	///where the scene outputs are named after
	static
	File outputBase(final String baseName, final File outputFolder)
	{
		//no common file name prefix, just a common folder
		final boolean onlyFolder = baseName.isEmpty()
			|| baseName.endsWith("/") || baseName.endsWith(File.separator);

		final File base = onlyFolder ? new File(baseName.isEmpty() ? "." : baseName, DEFAULT_BASE_NAME)
		                             : new File(baseName);
		return outputFolder == null ? base : new File(outputFolder, base.getName());
	}

	static final String DEFAULT_BASE_NAME = "LandsatFire";
}
