package io.daylit.roi.service.impl;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.daylit.roi.config.RoiAssumptionsProperties;
import io.daylit.roi.dao.IndustryBenchmarkDao;
import io.daylit.roi.dao.PricingTierDao;
import io.daylit.roi.exception.NotValidException;
import io.daylit.roi.exception.RoiExceptionMessage;
import io.daylit.roi.helper.BenefitCalculationHelper;
import io.daylit.roi.service.RoiCalculationService;
import io.daylit.roi.vo.DsoComparison;
import io.daylit.roi.vo.IndustryBenchmark;
import io.daylit.roi.vo.PricingTier;
import io.daylit.roi.vo.RoiAssumptions;
import io.daylit.roi.vo.RoiInputs;
import io.daylit.roi.vo.RoiResults;
import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class RoiCalculationServiceImpl implements RoiCalculationService {

	private static final Logger log = LoggerFactory.getLogger(RoiCalculationServiceImpl.class);

	private final PricingTierDao pricingTierDao;

	private final IndustryBenchmarkDao industryBenchmarkDao;

	private final BenefitCalculationHelper calculationHelper;

	private final RoiAssumptionsProperties assumptionsProperties;

	@Override
	public PricingTier resolveTier(double annualRevenue) {
		return pricingTierDao.resolveTier(annualRevenue);
	}

	@Override
	public Optional<Integer> lookupIndustryBenchmark(String industry) {
		return industryBenchmarkDao.findByIndustry(industry).map(IndustryBenchmark::getBenchmarkDsoDays);
	}

	@Override
	public Optional<IndustryBenchmark> findIndustryBenchmark(String industry) {
		return industryBenchmarkDao.findByIndustry(industry);
	}

	@Override
	public List<String> listSupportedIndustries() {
		return industryBenchmarkDao.findAll().stream().map(IndustryBenchmark::getIndustry)
			.collect(Collectors.toUnmodifiableList());
	}

	@Override
	public List<IndustryBenchmark> findIndustryBenchmarks() {
		return industryBenchmarkDao.findAll();
	}

	@Override
	public Optional<DsoComparison> compareToBenchmark(String industry, double currentDsoDays) {
		return industryBenchmarkDao.findByIndustry(industry).map(b -> DsoComparison.of(b, currentDsoDays));
	}

	@Override
	public RoiResults calculateAll(RoiInputs inputs, RoiAssumptions assumptions) {
		if (inputs == null) {
			throw new NotValidException(RoiExceptionMessage.INPUTS_REQUIRED);
		}
		if (assumptions == null) {
			throw new NotValidException(RoiExceptionMessage.ASSUMPTIONS_REQUIRED);
		}
		PricingTier tier = pricingTierDao.resolveTier(inputs.getAnnualRevenue());

		double cashFlowImprovement = calculationHelper.computeCashFlowImprovement(inputs, assumptions);
		double employeeSavings = calculationHelper.computeAnnualizedEmployeeSavings(inputs, assumptions);
		double productivityHoursSaved = calculationHelper.computeProductivityHoursSaved(inputs, assumptions);
		double badDebtSavings = calculationHelper.computeBadDebtSavings(inputs, assumptions);

		// freed cash is reported on its own and stays out of the ROI benefit
		double totalBenefit = employeeSavings + badDebtSavings;
		double roiPct = calculationHelper.computeRoiPct(totalBenefit, tier.getAnnualPrice());
		double opportunityCost = totalBenefit * assumptions.getCostOfCapitalAnnualPct();

		log.debug("ROI for industry={} arr={}: tier={}, benefit={}, roi={}%", inputs.getIndustry(),
			inputs.getAnnualRevenue(), tier.getName(), totalBenefit, roiPct);

		return RoiResults.builder()
			.roiPct(roiPct)
			.cashFlowImprovementUsd(cashFlowImprovement)
			.annualizedEmployeeSavingsUsd(employeeSavings)
			.productivityHoursSaved(productivityHoursSaved)
			.badDebtSavingsUsd(badDebtSavings)
			.totalBenefitUsd(totalBenefit)
			.opportunityCostUsd(opportunityCost)
			.tier(tier.getName())
			.annualPriceUsd(tier.getAnnualPrice())
			.build();
	}

	@Override
	public RoiResults calculateAll(RoiInputs inputs) {
		return calculateAll(inputs, assumptionsProperties.toAssumptions());
	}
}
