package io.daylit.roi.dao.impl;

import static io.daylit.roi.util.ConstantUtility.TIER_ENTERPRISE;
import static io.daylit.roi.util.ConstantUtility.TIER_MIDDLE_MARKET;
import static io.daylit.roi.util.ConstantUtility.TIER_SMALL;

import java.util.List;

import org.springframework.stereotype.Repository;

import io.daylit.roi.dao.PricingTierDao;
import io.daylit.roi.vo.PricingTier;
import lombok.extern.slf4j.Slf4j;

@Repository
@Slf4j
public class PricingTierDaoImpl implements PricingTierDao {

	// Small: < 25M ARR, Middle market: 25M - 50M, Enterprise: >= 50M
	private static final List<PricingTier> TIERS = List.of(
		new PricingTier(TIER_SMALL, 0.0, 25_000_000.0, 12_000.0),
		new PricingTier(TIER_MIDDLE_MARKET, 25_000_000.0, 50_000_000.0, 60_000.0),
		new PricingTier(TIER_ENTERPRISE, 50_000_000.0, Double.POSITIVE_INFINITY, 100_000.0));

	@Override
	public List<PricingTier> findAllTiers() {
		return TIERS;
	}

	@Override
	public PricingTier resolveTier(double annualRevenue) {
		List<PricingTier> tiers = findAllTiers();
		for (PricingTier tier : tiers) {
			if (tier.contains(annualRevenue)) {
				return tier;
			}
		}
		PricingTier fallback = tiers.get(tiers.size() - 1);
		log.warn("No pricing tier covers ARR {}, falling back to {}", annualRevenue, fallback.getName());
		return fallback;
	}
}
