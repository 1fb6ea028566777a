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
 * Threshold constants of the daytime Landsat-8 OLI active fire algorithm,
 * Schroeder W, Oliva P, Giglio L, Quayle B, Lorenz E, Morelli F.
 * "Active fire detection using Landsat-8/OLI data."
 * Remote Sensing of Environment 185 (2016) 210-220.
 *
 * The defaults are the published values. All fields are public so that
 * a caller can override any of them before handing the object over to
 * the workers; the workers only read them.
 *
 * Naming: rhoN is the TOA reflectance of band N, R75 = rho7/rho5,
 * R76 = rho7/rho6, D75 = rho7-rho5, D17 = rho1-rho7.
 */
public class FireParams
{
	// ------------- unambiguous fire -------------
	public double unambiguousMinR75 = 2.5;
	public double unambiguousMinD75 = 0.3;
	public double unambiguousMinRho7 = 0.5;

	// ------------- DN folding -------------
	public double dnFoldMinRho6 = 0.8;
	public double dnFoldMaxRho1 = 0.2;
	public double dnFoldMinRho5 = 0.4;
	public double dnFoldMaxRho7 = 0.1;

	// ------------- water -------------
	///the D17 upper bound of the water test
	public double waterMaxD17 = 0.2;

	// ------------- candidate (potential) fire -------------
	public double candidateMinR75 = 1.8;
	public double candidateMinD75 = 0.17;
	public double candidateMinR76 = 1.6;

	// ------------- contextual test -------------
	///the k in: value > mean + max(k*stdDev, floor)
	public double stdDevMultiplier = 3.0;
	///the floor for the R75 contextual test
	public double minR75Deviation = 0.8;
	///the floor for the rho7 contextual test
	public double minRho7Deviation = 0.08;
	/** the local background weight must be strictly greater than this
	    for the contextual test to be considered at all */
	public double minBackgroundWeight = 0.0;

	public FireParams()
	{}

	///copy constructor
	public FireParams(final FireParams p)
	{
		unambiguousMinR75 = p.unambiguousMinR75;
		unambiguousMinD75 = p.unambiguousMinD75;
		unambiguousMinRho7 = p.unambiguousMinRho7;

		dnFoldMinRho6 = p.dnFoldMinRho6;
		dnFoldMaxRho1 = p.dnFoldMaxRho1;
		dnFoldMinRho5 = p.dnFoldMinRho5;
		dnFoldMaxRho7 = p.dnFoldMaxRho7;

		waterMaxD17 = p.waterMaxD17;

		candidateMinR75 = p.candidateMinR75;
		candidateMinD75 = p.candidateMinD75;
		candidateMinR76 = p.candidateMinR76;

		stdDevMultiplier = p.stdDevMultiplier;
		minR75Deviation = p.minR75Deviation;
		minRho7Deviation = p.minRho7Deviation;
		minBackgroundWeight = p.minBackgroundWeight;
	}

	@Override
	public String toString()
	{
		return "unambiguous: R75>"+unambiguousMinR75+" D75>"+unambiguousMinD75+" rho7>"+unambiguousMinRho7
		    +"; DN folding: rho6>"+dnFoldMinRho6+" rho1<"+dnFoldMaxRho1
		    +" (rho5>"+dnFoldMinRho5+" or rho7<"+dnFoldMaxRho7+")"
		    +"; water: D17<"+waterMaxD17
		    +"; candidate: R75>"+candidateMinR75+" D75>"+candidateMinD75+" R76>"+candidateMinR76
		    +"; context: k="+stdDevMultiplier+" floors "+minR75Deviation+"/"+minRho7Deviation
		    +" weight>"+minBackgroundWeight;
	}
}
