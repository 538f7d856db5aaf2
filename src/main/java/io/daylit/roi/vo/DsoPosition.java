package io.daylit.roi.vo;

public enum DsoPosition {
	ABOVE, BELOW, AT;

	public static DsoPosition fromDifference(double differenceDays) {
		if (differenceDays > 0) return ABOVE;
		if (differenceDays < 0) return BELOW;
		return AT;
	}
}
