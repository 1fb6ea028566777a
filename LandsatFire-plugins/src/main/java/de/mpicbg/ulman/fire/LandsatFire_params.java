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

import org.scijava.command.Command;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

import de.mpicbg.ulman.fire.util.FireParams;

/** A no-op plugin existing here only to harvest the detection thresholds.
    The parameters here should be mirrored in the toFireParams(). */
@Plugin(type = Command.class)
public class LandsatFire_params implements Command
{
	@Parameter(label = "Unambiguous fire: min R75")
	double unambiguousMinR75 = 2.5;
	@Parameter(label = "Unambiguous fire: min D75")
	double unambiguousMinD75 = 0.3;
	@Parameter(label = "Unambiguous fire: min SWIR 2")
	double unambiguousMinRho7 = 0.5;

	@Parameter(label = "DN folding: min SWIR 1")
	double dnFoldMinRho6 = 0.8;
	@Parameter(label = "DN folding: max coastal aerosol")
	double dnFoldMaxRho1 = 0.2;
	@Parameter(label = "DN folding: min NIR")
	double dnFoldMinRho5 = 0.4;
	@Parameter(label = "DN folding: max SWIR 2")
	double dnFoldMaxRho7 = 0.1;

	@Parameter(label = "Water: max D17")
	double waterMaxD17 = 0.2;

	@Parameter(label = "Candidate: min R75")
	double candidateMinR75 = 1.8;
	@Parameter(label = "Candidate: min D75")
	double candidateMinD75 = 0.17;
	@Parameter(label = "Candidate: min R76")
	double candidateMinR76 = 1.6;

	@Parameter(label = "Background: std. dev. multiplier")
	double stdDevMultiplier = 3.0;
	@Parameter(label = "Background: min R75 deviation")
	double minR75Deviation = 0.8;
	@Parameter(label = "Background: min SWIR 2 deviation")
	double minRho7Deviation = 0.08;
	@Parameter(label = "Background: min weight", min = "0", max = "1")
	double minBackgroundWeight = 0.0;

	public FireParams toFireParams()
	{
		final FireParams p = new FireParams();
		p.unambiguousMinR75 = unambiguousMinR75;
		p.unambiguousMinD75 = unambiguousMinD75;
		p.unambiguousMinRho7 = unambiguousMinRho7;
		p.dnFoldMinRho6 = dnFoldMinRho6;
		p.dnFoldMaxRho1 = dnFoldMaxRho1;
		p.dnFoldMinRho5 = dnFoldMinRho5;
		p.dnFoldMaxRho7 = dnFoldMaxRho7;
		p.waterMaxD17 = waterMaxD17;
		p.candidateMinR75 = candidateMinR75;
		p.candidateMinD75 = candidateMinD75;
		p.candidateMinR76 = candidateMinR76;
		p.stdDevMultiplier = stdDevMultiplier;
		p.minR75Deviation = minR75Deviation;
		p.minRho7Deviation = minRho7Deviation;
		p.minBackgroundWeight = minBackgroundWeight;
		return p;
	}

	@Override
	public void run()
	{ /* intentionally empty */ }
}
