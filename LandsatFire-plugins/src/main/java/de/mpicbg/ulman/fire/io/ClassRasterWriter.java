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
import ij.io.FileSaver;
import ij.process.ByteProcessor;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

import java.io.File;
import java.io.IOException;

import de.mpicbg.ulman.fire.util.FireMasks;

public class ClassRasterWriter
{
	///shortcuts to some Fiji services
	private final LogService log;

	///a constructor requiring connection to Fiji report/log services
	public ClassRasterWriter(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	public static final String CLASS_SUFFIX = "_CLASS_PIX.tif";
	public static final String FIRE_SUFFIX = "_FIRE_PIX.tif";
	public static final String DN_FOLD_SUFFIX = "_DN_FOLD_PIX.tif";
	public static final String WATER_SUFFIX = "_WATER_PIX.tif";
	public static final String POTENTIAL_FIRE_SUFFIX = "_POTENTIAL_FIRE_PIX.tif";

	/** Saves the classification image (values 0..3) into 'path'. */
	public void writeClasses(final Img<UnsignedByteType> classes, final String path)
	throws IOException
	{
		save(classes, path);
	}

	/** Saves every per-test mask as a 0/255 image named 'baseName'+suffix,
	    returns the paths of the written files. The masks are saved as they
	    come, so whatever edge masking the 'masks' carry is what is written. */
	public String[] writeDiagnostics(final FireMasks masks, final String baseName)
	throws IOException
	{
		final String[] paths = {
			baseName+FIRE_SUFFIX, baseName+DN_FOLD_SUFFIX,
			baseName+WATER_SUFFIX, baseName+POTENTIAL_FIRE_SUFFIX };

		save(toBytes(masks.unambiguousFire), paths[0]);
		save(toBytes(masks.dnFolding), paths[1]);
		save(toBytes(masks.water), paths[2]);
		save(toBytes(masks.potentialFire), paths[3]);
		return paths;
	}

	///mask to 0/255 image
	static
	Img<UnsignedByteType> toBytes(final Img<BitType> mask)
	{
		final Img<UnsignedByteType> out = ArrayImgs.unsignedBytes(mask.dimension(0), mask.dimension(1));
		LoopBuilder.setImages(mask, out).forEachPixel( (m,o) -> o.set(m.get() ? 255 : 0) );
		return out;
	}

	///8-bit ImageJ image of the same size and content
	static
	ImagePlus toImagePlus(final RandomAccessibleInterval<UnsignedByteType> img, final String title)
	{
		final int width  = (int)img.dimension(0);
		final int height = (int)img.dimension(1);

		final byte[] pixels = new byte[width*height];
		final Cursor<UnsignedByteType> c = Views.flatIterable(img).cursor();
		for (int i=0; c.hasNext(); ++i)
			pixels[i] = (byte)c.next().get();

		return new ImagePlus(title, new ByteProcessor(width,height, pixels));
	}

	private void save(final Img<UnsignedByteType> img, final String path)
	throws IOException
	{
		log.info("Saving file: "+path);
		final ImagePlus imp = toImagePlus(img, new File(path).getName());

		boolean saved = false;
		try {
			IJ.redirectErrorMessages(true);
			saved = new FileSaver(imp).saveAsTiff(path);
		}
		catch (RuntimeException e) {
			log.error("Error writing file: "+path);
			log.error("Error msg: "+e);
			throw new IOException("Unable to write output file: "+path, e);
		}

		if (!saved)
		{
			log.error("Error writing file: "+path);
			throw new IOException("Unable to write output file: "+path);
		}
	}
}
