/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2021 LandsatFire contributors
 */
package de.mpicbg.ulman.fire.vector;

import org.scijava.log.LogService;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Writes the class polygons as a GeoJSON FeatureCollection, every feature
 * carries the class value in "Value" and the class name in "Class".
 */
public class GeoJsonFeatureWriter
{
	///shortcuts to some Fiji services
	private final LogService log;

	public static final String DEFAULT_FILE_NAME = "Classified_Pixels.geojson";

	///a constructor requiring connection to Fiji report/log services
	public GeoJsonFeatureWriter(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	public void write(final List<ClassPolygon> polygons, final File path)
	throws IOException
	{
		log.info("Writing "+polygons.size()+" features into: "+path.getPath());
		try (Writer out = Files.newBufferedWriter(path.toPath(), StandardCharsets.UTF_8))
		{
			write(polygons, out);
		}
	}

	public void write(final List<ClassPolygon> polygons, final Writer out)
	throws IOException
	{
		toFeatureCollection(polygons).writeJSONString(out);
		out.flush();
	}

	@SuppressWarnings("unchecked")
	public static
	JSONObject toFeatureCollection(final List<ClassPolygon> polygons)
	{
		final JSONArray features = new JSONArray();
		for (ClassPolygon p : polygons)
			features.add(toFeature(p));

		final JSONObject collection = new JSONObject();
		collection.put("type", "FeatureCollection");
		collection.put("name", "polygonized");
		collection.put("features", features);
		return collection;
	}

	@SuppressWarnings("unchecked")
	public static
	JSONObject toFeature(final ClassPolygon polygon)
	{
		final JSONObject properties = new JSONObject();
		properties.put("Value", polygon.value());
		properties.put("Class", polygon.fireClass.label);

		final JSONObject feature = new JSONObject();
		feature.put("type", "Feature");
		feature.put("properties", properties);
		feature.put("geometry", toGeometry(polygon.geometry));
		return feature;
	}

	@SuppressWarnings("unchecked")
	static
	JSONObject toGeometry(final Geometry g)
	{
		final JSONObject geometry = new JSONObject();
		if (g instanceof Polygon)
		{
			geometry.put("type", "Polygon");
			geometry.put("coordinates", polygonCoordinates((Polygon)g));
		}
		else if (g instanceof MultiPolygon)
		{
			final JSONArray parts = new JSONArray();
			for (int i=0; i < g.getNumGeometries(); ++i)
				parts.add(polygonCoordinates((Polygon)g.getGeometryN(i)));
			geometry.put("type", "MultiPolygon");
			geometry.put("coordinates", parts);
		}
		else
			throw new IllegalArgumentException("Not a polygonal geometry: "+g.getGeometryType());

		return geometry;
	}

	@SuppressWarnings("unchecked")
	private static
	JSONArray polygonCoordinates(final Polygon p)
	{
		final JSONArray rings = new JSONArray();
		rings.add(ringCoordinates(p.getExteriorRing()));
		for (int i=0; i < p.getNumInteriorRing(); ++i)
			rings.add(ringCoordinates(p.getInteriorRingN(i)));
		return rings;
	}

	@SuppressWarnings("unchecked")
	private static
	JSONArray ringCoordinates(final LineString ring)
	{
		final JSONArray coords = new JSONArray();
		for (Coordinate c : ring.getCoordinates())
		{
			final JSONArray xy = new JSONArray();
			xy.add(c.x);
			xy.add(c.y);
			coords.add(xy);
		}
		return coords;
	}
}
