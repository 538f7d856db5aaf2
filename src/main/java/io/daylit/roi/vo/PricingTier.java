package io.daylit.roi.vo;

import lombok.Value;

/**
 * One row of the ARR pricing table. The interval is {@code [lowerBound, upperBound)}.
 */
@Value
public class PricingTier {
	String name;
	double lowerBound;
	double upperBound;
	double annualPrice;

	public boolean contains(double annualRevenue) {
		return lowerBound <= annualRevenue && annualRevenue < upperBound;
	}
}
