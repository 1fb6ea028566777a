/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.io;

import org.scijava.log.LogService;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ImageProcessor;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

import org.locationtech.jts.geom.util.AffineTransformation;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import de.mpicbg.ulman.fire.util.LandsatBands;
import de.mpicbg.ulman.fire.vector.GeoTransforms;

/**
 * Band source over a set of Landsat band files named after the USGS
 * convention, i.e. with '_B<n>.' in the file name (e.g. LC08_..._B7.TIF).
 * Other files and bands beyond 7 are reported and ignored.
 */
public class FolderBandSource implements BandSource
{
	///shortcuts to some Fiji services
	private final LogService log;

	private final List<File> files;

	///all Landsat 8 band names, index 0 is band 1
	static final String[] ALL_BAND_NAMES = {
		"Coastal Aerosol", "Blue", "Green", "Red", "NIR", "SWIR 1", "SWIR 2",
		"Panchromatic", "Cirrus", "TIRS 1", "TIRS 2" };

	private static final Pattern BAND_NUMBER = Pattern.compile("_B(\\d+)\\.");

	public FolderBandSource(final LogService _log, final List<File> _files)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");
		if (_files == null || _files.isEmpty())
			throw new IllegalArgumentException("No band files supplied.");

		log = _log;
		files = new ArrayList<>(_files);
	}

	/** Collects all regular files of the 'folder', in name order. */
	public static
	List<File> filesOf(final File folder)
	throws IOException
	{
		final File[] content = folder.listFiles(File::isFile);
		if (content == null)
			throw new IOException("Cannot list folder: "+folder.getPath());

		java.util.Arrays.sort(content);
		return java.util.Arrays.asList(content);
	}

	///returns the band number encoded in the file name, or -1 if there is none
	public static
	int bandNumberOf(final String fileName)
	{
		final Matcher m = BAND_NUMBER.matcher(fileName);
		return m.find() ? Integer.parseInt(m.group(1)) : -1;
	}

	/** The longest common prefix of the 'paths', without the
	    trailing "_B" and underscores. */
	public static
	String baseNameOf(final List<String> paths)
	{
		String prefix = paths.get(0);
		for (String p : paths)
		{
			int i = 0;
			while (i < prefix.length() && i < p.length() && prefix.charAt(i) == p.charAt(i)) ++i;
			prefix = prefix.substring(0,i);
		}

		if (prefix.endsWith("_B")) prefix = prefix.substring(0, prefix.length()-2);
		while (prefix.endsWith("_")) prefix = prefix.substring(0, prefix.length()-1);
		return prefix;
	}

	/** Maps band numbers to their files, complains on duplicates. */
	Map<Integer,File> discoverBands()
	throws IOException
	{
		final Map<Integer,File> bandFiles = new TreeMap<>();
		for (File f : files)
		{
			final int n = bandNumberOf(f.getName());
			if (n < 1 || n > ALL_BAND_NAMES.length)
			{
				log.info("Not a Landsat band file, skipping: "+f.getName());
				continue;
			}
			if (bandFiles.containsKey(n))
				throw new IOException("Landsat band "+n+" given twice: "
					+bandFiles.get(n).getName()+" and "+f.getName());

			bandFiles.put(n, f);
		}
		return bandFiles;
	}

	@Override
	public LandsatBands load()
	throws IOException
	{
		final Map<Integer,File> bandFiles = discoverBands();
		for (int n=1; n <= LandsatBands.NO_OF_BANDS; ++n)
			if (!bandFiles.containsKey(n))
				throw new IOException("Landsat band "+n+" not loaded");

		for (Map.Entry<Integer,File> e : bandFiles.entrySet())
			if (e.getKey() > LandsatBands.NO_OF_BANDS)
				log.info("Band "+e.getKey()+" ("+ALL_BAND_NAMES[e.getKey()-1]+") is not used.");

		@SuppressWarnings("unchecked")
		final RandomAccessibleInterval<FloatType>[] bands
			= new RandomAccessibleInterval[LandsatBands.NO_OF_BANDS];

		for (int n=1; n <= LandsatBands.NO_OF_BANDS; ++n)
		{
			final String fname = bandFiles.get(n).getPath();
			bands[n-1] = readBand(fname);
			log.info("Band "+n+" loaded: "+ALL_BAND_NAMES[n-1]);
		}
		log.info("All required bands loaded.");

		return new LandsatBands(bands);
	}

	/// Loads the given filename AND checks it is a 2D scalar image.
	private Img<FloatType> readBand(final String fname)
	throws IOException
	{
		ImagePlus imp = null;
		try {
			//no dialogs, ImageJ reports into its log instead
			IJ.redirectErrorMessages(true);
			imp = new ImagePlus(fname);
		}
		catch (RuntimeException e) {
			log.error("Error reading file: "+fname);
			throw new IOException("Unable to read input file: "+fname, e);
		}

		if (imp.getProcessor() == null || imp.getWidth() == 0)
		{
			log.error("Error reading file: "+fname);
			throw new IOException("Unable to read input file: "+fname);
		}
		if (imp.getType() == ImagePlus.COLOR_RGB || imp.getType() == ImagePlus.COLOR_256)
			throw new IOException("Band pixels must be scalars: "+fname);
		if (imp.getStackSize() != 1)
			throw new IOException("Band must be a 2D image, got "+imp.getStackSize()
				+" slices: "+fname);

		return toFloats(imp.getProcessor());
	}

	///gray values of the 'ip', unsigned for 8 and 16 bit images
	static
	Img<FloatType> toFloats(final ImageProcessor ip)
	{
		final float[] pixels = new float[ip.getPixelCount()];
		for (int i=0; i < pixels.length; ++i)
			pixels[i] = ip.getf(i);
		return ArrayImgs.floats(pixels, ip.getWidth(), ip.getHeight());
	}

	@Override
	public String baseName()
	{
		final List<String> paths = new ArrayList<>(files.size());
		for (File f : files)
			if (bandNumberOf(f.getName()) > 0) paths.add(f.getPath());
		if (paths.isEmpty())
			for (File f : files) paths.add(f.getPath());

		return baseNameOf(paths);
	}

	/**
	 * Looks for an ESRI world file (.tfw or .wld) next to the band 1
	 * file and returns its transform, or null if there is none.
	 */
	@Override
	public AffineTransformation geoTransform()
	throws IOException
	{
		final File first = discoverBands().get(1);
		if (first == null)
		{
			log.info("No band 1 file, output vectors are in pixel coordinates.");
			return null;
		}

		final String name = first.getName();
		final int dot = name.lastIndexOf('.');
		final String stem = dot > 0 ? name.substring(0,dot) : name;

		for (String ext : new String[] { ".tfw", ".TFW", ".wld" })
		{
			final File wf = new File(first.getParentFile(), stem+ext);
			if (!wf.isFile()) continue;

			final List<String> lines = Files.readAllLines(wf.toPath(), StandardCharsets.UTF_8);
			final double[] w = new double[6];
			int cnt = 0;
			for (String l : lines)
			{
				if (l.trim().isEmpty()) continue;
				if (cnt == 6) break;
				try {
					w[cnt++] = Double.parseDouble(l.trim());
				}
				catch (NumberFormatException e) {
					throw new IOException("Malformed world file "+wf.getName()+": "+l, e);
				}
			}
			if (cnt < 6)
				throw new IOException("World file "+wf.getName()+" has less than 6 lines.");

			log.info("Georeferencing from: "+wf.getName());
			return GeoTransforms.fromWorldFile(w);
		}

		log.info("No world file found, output vectors are in pixel coordinates.");
		return null;
	}
}
