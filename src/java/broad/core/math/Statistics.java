package broad.core.math;

import java.util.List;

public class Statistics {

	/**
	 * Mean of the values, skipping NaN entries
	 */
	public static double mean(double [] values) {
		double total = 0;
		int counter=0;
		for (int i = 0; i < values.length; i++) {
			if(!Double.isNaN(values[i])){
				total = total + values[i];
				counter++;
			}
		}

		return total/counter;
	}

	public static double sum(List<Double> vals){
		double rtrn=0;
		for(int i=0; i<vals.size(); i++){
			rtrn+=vals.get(i);
		}
		return rtrn;
	}
}
