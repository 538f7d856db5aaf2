package io.daylit.roi.dao;

import java.util.List;

import io.daylit.roi.vo.PricingTier;

public interface PricingTierDao {

	/** Tiers ordered by ascending lower bound; together they cover [0, +inf). */
	List<PricingTier> findAllTiers();

	/**
	 * Resolve the tier whose interval contains the given ARR. Values on a boundary fall
	 * into the higher tier. Input that matches no row (negative, NaN) resolves to the last row.
	 */
	PricingTier resolveTier(double annualRevenue);
}
