package io.daylit.roi.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Client supplied business inputs. Values are taken as given; callers sanitise them.
 */
@Value
@Builder(toBuilder = true)
public class RoiInputs {
	String industry;           // informational, drives the benchmark lookup only
	double annualRevenue;      // USD/year (ARR)
	int arHeadcount;           // FTEs managing A/R
	double currentDsoDays;     // days
	int monthlyInvoices;       // count per month, not used by any formula
	double fteSalaryBase;      // USD/year per FTE
	double badDebtPct;         // fraction of A/R balance lost annually, e.g. 0.01
}
