package io.daylit.roi.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.daylit.roi.config.RoiAssumptionsProperties;
import io.daylit.roi.dao.PricingTierDao;
import io.daylit.roi.dao.impl.IndustryBenchmarkDaoImpl;
import io.daylit.roi.dao.impl.PricingTierDaoImpl;
import io.daylit.roi.exception.NotValidException;
import io.daylit.roi.exception.RoiExceptionMessage;
import io.daylit.roi.helper.BenefitCalculationHelper;
import io.daylit.roi.vo.DsoPosition;
import io.daylit.roi.vo.PricingTier;
import io.daylit.roi.vo.RoiAssumptions;
import io.daylit.roi.vo.RoiInputs;
import io.daylit.roi.vo.RoiResults;

class RoiCalculationServiceImplTest {

	private RoiCalculationServiceImpl service;

	@BeforeEach
	void setUp() {
		service = new RoiCalculationServiceImpl(new PricingTierDaoImpl(), new IndustryBenchmarkDaoImpl(),
			new BenefitCalculationHelper(), new RoiAssumptionsProperties());
	}

	private RoiInputs sampleClient() {
		return RoiInputs.builder()
			.industry("Hospitals/Healthcare Facilities")
			.annualRevenue(1_200_000)
			.arHeadcount(3)
			.currentDsoDays(65.0)
			.monthlyInvoices(5000)
			.fteSalaryBase(80_000.0)
			.badDebtPct(0.05)
			.build();
	}

	@Test
	void calculateAll_sampleClient_endToEnd() {
		RoiResults results = service.calculateAll(sampleClient(), RoiAssumptions.defaults());

		assertThat(results.getTier()).isEqualTo("Small");
		assertThat(results.getAnnualPriceUsd()).isEqualTo(12_000.0);
		assertThat(results.getCashFlowImprovementUsd()).isCloseTo(85_479.45, within(0.01));
		assertThat(results.getAnnualizedEmployeeSavingsUsd()).isCloseTo(96_000.0, within(0.01));
		assertThat(results.getProductivityHoursSaved()).isCloseTo(2_400.0, within(1e-6));
		assertThat(results.getBadDebtSavingsUsd()).isCloseTo(4_273.97, within(0.01));
		assertThat(results.getTotalBenefitUsd()).isCloseTo(100_273.97, within(0.01));
		assertThat(results.getRoiPct()).isCloseTo(735.62, within(0.01));
		assertThat(results.getOpportunityCostUsd()).isCloseTo(4_512.33, within(0.01));
	}

	@Test
	void calculateAll_cashFlowIsExcludedFromBenefit() {
		RoiResults results = service.calculateAll(sampleClient(), RoiAssumptions.defaults());

		assertThat(results.getTotalBenefitUsd())
			.isEqualTo(results.getAnnualizedEmployeeSavingsUsd() + results.getBadDebtSavingsUsd());
		assertThat(results.getOpportunityCostUsd()).isEqualTo(results.getTotalBenefitUsd() * 0.045);
	}

	@Test
	void calculateAll_isIdempotent() {
		RoiResults first = service.calculateAll(sampleClient(), RoiAssumptions.defaults());
		RoiResults second = service.calculateAll(sampleClient(), RoiAssumptions.defaults());

		assertThat(second).isEqualTo(first);
		assertThat(Double.doubleToRawLongBits(second.getRoiPct()))
			.isEqualTo(Double.doubleToRawLongBits(first.getRoiPct()));
	}

	@Test
	void calculateAll_withoutAssumptions_usesConfiguredDefaults() {
		assertThat(service.calculateAll(sampleClient()))
			.isEqualTo(service.calculateAll(sampleClient(), RoiAssumptions.defaults()));
	}

	@Test
	void calculateAll_benefitBelowPrice_givesNegativeRoi() {
		RoiInputs enterprise = sampleClient().toBuilder().annualRevenue(60_000_000).arHeadcount(1)
			.fteSalaryBase(40_000).badDebtPct(0.0).build();

		RoiResults results = service.calculateAll(enterprise, RoiAssumptions.defaults());

		// 1 x 1600 x 0.5 x 20 = 16,000 against a 100,000 price
		assertThat(results.getTier()).isEqualTo("Enterprise");
		assertThat(results.getTotalBenefitUsd()).isCloseTo(16_000.0, within(1e-6));
		assertThat(results.getRoiPct()).isNegative();
	}

	@Test
	void calculateAll_benefitEqualToPrice_givesZeroRoi() {
		// 1 FTE, all time on invoices, all of it saved: benefit equals the salary
		RoiInputs breakEven = sampleClient().toBuilder().arHeadcount(1).fteSalaryBase(12_000).badDebtPct(0.0)
			.build();
		RoiAssumptions full = RoiAssumptions.builder().productivityTimeSavedPct(1.0).percentageOfTimeOnInvoices(1.0)
			.build();

		assertThat(service.calculateAll(breakEven, full).getRoiPct()).isZero();
	}

	@Test
	void calculateAll_freeTier_givesInfiniteRoi() {
		PricingTierDao freeTiers = mock(PricingTierDao.class);
		when(freeTiers.resolveTier(1_200_000)).thenReturn(new PricingTier("Pilot", 0, Double.POSITIVE_INFINITY, 0));
		service = new RoiCalculationServiceImpl(freeTiers, new IndustryBenchmarkDaoImpl(),
			new BenefitCalculationHelper(), new RoiAssumptionsProperties());

		RoiResults results = service.calculateAll(sampleClient(), RoiAssumptions.defaults());

		assertThat(results.getTier()).isEqualTo("Pilot");
		assertThat(results.getRoiPct()).isEqualTo(Double.POSITIVE_INFINITY);
	}

	@Test
	void calculateAll_nullArguments_areRejected() {
		assertThatThrownBy(() -> service.calculateAll(null, RoiAssumptions.defaults()))
			.isInstanceOf(NotValidException.class)
			.extracting("code").isEqualTo(RoiExceptionMessage.INPUTS_REQUIRED);
		assertThatThrownBy(() -> service.calculateAll(sampleClient(), null))
			.isInstanceOf(NotValidException.class)
			.extracting("code").isEqualTo(RoiExceptionMessage.ASSUMPTIONS_REQUIRED);
	}

	@Test
	void resolveTier_delegatesToTierTable() {
		assertThat(service.resolveTier(25_000_000).getName()).isEqualTo("Middle market");
		assertThat(service.resolveTier(25_000_000).getAnnualPrice()).isEqualTo(60_000.0);
	}

	@Test
	void lookupIndustryBenchmark_knownAndUnknown() {
		assertThat(service.lookupIndustryBenchmark("Hospitals/Healthcare Facilities")).contains(53);
		assertThat(service.lookupIndustryBenchmark("Nonexistent")).isEmpty();
	}

	@Test
	void listSupportedIndustries_inTableOrder() {
		assertThat(service.listSupportedIndustries()).containsExactly("Retail Distributors", "Chemical (Specialty)",
			"Hospitals/Healthcare Facilities", "Business & Consumer Services");
	}

	@Test
	void compareToBenchmark_reportsDifferenceAndPosition() {
		assertThat(service.compareToBenchmark("Hospitals/Healthcare Facilities", 65.0))
			.hasValueSatisfying(c -> {
				assertThat(c.getBenchmarkDsoDays()).isEqualTo(53);
				assertThat(c.getDifferenceDays()).isEqualTo(12.0);
				assertThat(c.getPosition()).isEqualTo(DsoPosition.ABOVE);
			});
		assertThat(service.compareToBenchmark("Retail Distributors", 30.0))
			.hasValueSatisfying(c -> assertThat(c.getPosition()).isEqualTo(DsoPosition.BELOW));
		assertThat(service.compareToBenchmark("Nonexistent", 30.0)).isEmpty();
	}
}
