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

import java.io.File;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line of the form: key=value ... file1 file2 ...
 * Arguments with '=' are options, the others are input files.
 */
public class KeyValueArgs
{
	public static final String WINDOW_SIZE = "window_size";
	public static final String MASK_EDGES = "mask_edges";
	public static final String EDGE_BORDER_WIDTH = "edge_border_width";
	public static final String EMIT_RASTER = "emit_raster";
	public static final String EMIT_DIAGNOSTICS = "emit_diagnostics";
	///older name of EMIT_DIAGNOSTICS
	public static final String WRITEVALS = "writevals";
	public static final String THREADS = "threads";
	public static final String OUTPUT = "output";

	private static final List<String> KNOWN_KEYS = java.util.Arrays.asList(
		WINDOW_SIZE, MASK_EDGES, EDGE_BORDER_WIDTH, EMIT_RASTER,
		EMIT_DIAGNOSTICS, WRITEVALS, THREADS, OUTPUT);

	private final Map<String,String> options = new LinkedHashMap<>();
	private final List<File> files = new ArrayList<>();

	public KeyValueArgs(final String... args)
	throws ParseException
	{
		int pos = 0;
		for (String arg : args)
		{
			final int eq = arg.indexOf('=');
			if (eq == -1)
				files.add(new File(arg));
			else
			{
				final String key = arg.substring(0,eq).trim().toLowerCase();
				final String value = arg.substring(eq+1).trim();
				if (!KNOWN_KEYS.contains(key))
					throw new ParseException("Unknown option '"+key+"', known are: "+KNOWN_KEYS, pos);
				if (value.isEmpty())
					throw new ParseException("No value given for option '"+key+"'", pos);
				options.put(key, value);
			}
			++pos;
		}
	}

	public Map<String,String> options()
	{ return Collections.unmodifiableMap(options); }

	public List<File> files()
	{ return Collections.unmodifiableList(files); }

	///the output folder, or null if not given
	public File output()
	{
		final String o = options.get(OUTPUT);
		return o == null ? null : new File(o);
	}

	/** Overlays the given options over the 'defaults'. */
	public FireConfig toConfig(final FireConfig defaults)
	throws ParseException
	{
		final FireConfig.Builder b = defaults.toBuilder();

		String v;
		if ((v = options.get(WINDOW_SIZE)) != null) b.windowSize(parseInt(WINDOW_SIZE, v));
		if ((v = options.get(MASK_EDGES)) != null) b.maskEdges(strToBool(v));
		if ((v = options.get(EDGE_BORDER_WIDTH)) != null) b.edgeBorderWidth(parseInt(EDGE_BORDER_WIDTH, v));
		if ((v = options.get(EMIT_RASTER)) != null) b.emitRaster(strToBool(v));
		if ((v = options.get(WRITEVALS)) != null) b.emitDiagnostics(strToBool(v));
		if ((v = options.get(EMIT_DIAGNOSTICS)) != null) b.emitDiagnostics(strToBool(v));
		if ((v = options.get(THREADS)) != null) b.threads(parseInt(THREADS, v));

		return b.build();
	}

	/** True values are y, yes, t, true, on and 1; false values are
	    n, no, f, false, off and 0. Case is ignored. */
	public static
	boolean strToBool(final String value)
	throws ParseException
	{
		switch (value.trim().toLowerCase())
		{
		case "y": case "yes": case "t": case "true": case "on": case "1":
			return true;
		case "n": case "no": case "f": case "false": case "off": case "0":
			return false;
		default:
			throw new ParseException("Invalid truth value '"+value+"'", 0);
		}
	}

	private static
	int parseInt(final String key, final String value)
	throws ParseException
	{
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new ParseException("Option '"+key+"' needs an integer, got '"+value+"'", 0);
		}
	}
}
