package edu.isi.wfst;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring {
	private static final long serialVersionUID = 1L;
	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		if (isZero(a) || isZero(b))
			return ZERO();
		return a+b;
	}
	public double divide(double a, double b) throws UnusualConditionException {
		if (isZero(b))
			throw new UnusualConditionException("Tried to divide "+a+" by tropical zero");
		if (isZero(a))
			return ZERO();
		return a-b;
	}
	public double power(double a, double p) {
		if (p == 0)
			return ONE();
		if (isZero(a))
			return ZERO();
		return a*p;
	}
	public double ZERO(){return  Double.POSITIVE_INFINITY;}
	public double ONE() {
		return 0;
	}
	public String getName() { return "tropical"; }
	public double realToInternal(double p) throws UnusualConditionException {
		if (Double.isNaN(p) || p < 0)
			throw new UnusualConditionException("Can't represent "+p+" as a tropical weight");
		return -Math.log(p);
	}
	public double internalToReal(double a) { return Math.exp(-a);}
}
