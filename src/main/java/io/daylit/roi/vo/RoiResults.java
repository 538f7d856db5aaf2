package io.daylit.roi.vo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoiResults {
	double roiPct;                          // 150.0 means 150%
	double cashFlowImprovementUsd;          // freed working capital, not part of the ROI benefit
	double annualizedEmployeeSavingsUsd;
	double productivityHoursSaved;
	double badDebtSavingsUsd;
	double totalBenefitUsd;                 // employee savings + bad debt savings
	double opportunityCostUsd;
	String tier;
	double annualPriceUsd;
}
