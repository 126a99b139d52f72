package broad.core.math;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * @author prussell
 * Mann Whitney U test. Tied measurements share the mean of the ranks they span.
 * The U statistic of sample 1 divided by n1 * n2 is the area under the ROC curve when
 * sample 1 holds the scores of the positives and sample 2 those of the negatives.
 */
public class MannWhitney {

	private static final String SAMPLE_1_IDENTIFIER = "sample1";
	private static final String SAMPLE_2_IDENTIFIER = "sample2";

	private final int n1;
	private final int n2;
	private final double rankSum1;
	private final double z;
	private final double pValue;

	/**
	 * Instantiate with arrays of measurements
	 * @param sample1measurements Sample 1 measurements
	 * @param sample2measurements Sample 2 measurements
	 */
	public MannWhitney(double[] sample1measurements, double[] sample2measurements){
		if(sample1measurements.length == 0 || sample2measurements.length == 0) {
			throw new IllegalArgumentException("Both samples need at least one measurement, got " + sample1measurements.length + " and " + sample2measurements.length);
		}
		TreeMap<Double, List<String>> map=new TreeMap<Double, List<String>>();
		add(map, sample1measurements, SAMPLE_1_IDENTIFIER);
		add(map, sample2measurements, SAMPLE_2_IDENTIFIER);
		n1 = sample1measurements.length;
		n2 = sample2measurements.length;
		List<List<Double>> measurementsRanked=rankOrder(map);
		rankSum1 = Statistics.sum(measurementsRanked.get(0));
		z=calculateZ(rankSum1, n1, n2);
		pValue=calculatePvalue(z);
	}

	private static void add(TreeMap<Double, List<String>> map, double[] measurements, String sample) {
		for(int i=0; i < measurements.length; i++) {
			List<String> list=map.get(Double.valueOf(measurements[i]));
			if(list == null) {
				list=new ArrayList<String>();
				map.put(Double.valueOf(measurements[i]), list);
			}
			list.add(sample);
		}
	}

	/**
	 * Calculate P value assuming a standard normal distribution of test statistic under the null hypothesis
	 * @param statistic The test statistic
	 * @return The P value
	 */
	private static double calculatePvalue(double statistic){
		if(Double.isNaN(statistic)) {
			return 1;
		}
		double cdf=new NormalDistribution(0, 1).cumulativeProbability(statistic);
		return Math.min(1, Math.min((1-cdf), cdf)*2);
	}

	private static double calculateZ(double rankSum, int n1, int n2){
		double mu=(n1*(double)(n1+n2+1))/2.0;
		double var=(((double)n1*n2)*(n1+n2+1))/12.0;
		return (rankSum-mu)/Math.sqrt(var);
	}

	/**
	 * Get the test statistic
	 * @return The test statistic
	 */
	public double getZ() {
		return z;
	}

	/**
	 * Get P value
	 * @return P value
	 */
	public double getPvalue() {
		return pValue;
	}

	/**
	 * @return U statistic of sample 1, the number of (sample 1, sample 2) pairs where sample 1 is larger, ties counting one half
	 */
	public double getU() {
		return rankSum1 - (n1*(double)(n1+1))/2.0;
	}

	/**
	 * @return probability that a random sample 1 measurement exceeds a random sample 2 measurement, ties counting one half
	 */
	public double getAUC() {
		return getU()/((double)n1*n2);
	}

	/**
	 * Get the overall ranks of measurements from both samples
	 * 1 = low, N = high
	 * @param measurements Map of each measurement to the samples it was seen in, once per occurrence
	 * @return List whose first element is the list of sample 1 ranks and whose second element is the list of sample 2 ranks
	 */
	protected static List<List<Double>> rankOrder(TreeMap<Double, List<String>> measurements){
		List<Double> sample1ranks = new ArrayList<Double>();
		List<Double> sample2ranks = new ArrayList<Double>();
		double count=0;
		for(List<String> list: measurements.values()){
			// Rank accounting for ties
			double rank = rank(count, list.size());
			count += list.size();
			for(String str: list){
				if(SAMPLE_1_IDENTIFIER.equals(str)){
					sample1ranks.add(Double.valueOf(rank));
				} else {
					sample2ranks.add(Double.valueOf(rank));
				}
			}
		}
		List<List<Double>> rtrn = new ArrayList<List<Double>>(2);
		rtrn.add(sample1ranks);
		rtrn.add(sample2ranks);
		return rtrn;
	}

	protected static double rank(double count, int ties){
		// For tie (duplicated) values, returns the mean of the ranks of the duplicated values:
		// for first rank r and 4 duplicated values it should return  r+ (r+1) + (r+2) + (r+3) = 4*r + 1+2+3 =(in general) N*r + N(N-1)/2
		// But the rank passed (count) is one behind so we add 1.
		double N = ties;
		return (N*(count+1) + (N*(N - 1))/2)/N;
	}
}
