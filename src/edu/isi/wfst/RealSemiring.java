package edu.isi.wfst;

// real is +, *, 0, 1 but stored as negative logs, so it's really the log semiring
public class RealSemiring extends Semiring {
	private static final long serialVersionUID = 1L;

	static private int TOLERANCE=16;
	public double plus(double a, double b) {
		if (isZero(a)) return b;
		if (isZero(b)) return a;

		double x, y;
		if ((-a) > (-b)) {
			x = -a;
			y = -b;
		}
		else {
			x = -b;
			y = -a;
		}
		// x>=y. If x>>y, estimate as x
		if (x >= y+TOLERANCE)
			return -x;
		double diff = y-x;
		double logtotal = Math.log1p(Math.exp(diff));
		return -(x + logtotal);
	}

	public double times(double a, double b) {
		if (isZero(a) || isZero(b))
			return ZERO();
		return Math.min(a+b, ZERO());
	}
	public double divide(double a, double b) throws UnusualConditionException {
		if (isZero(b))
			throw new UnusualConditionException("Tried to divide "+a+" by log zero");
		if (isZero(a))
			return ZERO();
		return a-b;
	}
	public double power(double a, double p) {
		if (p == 0)
			return ONE();
		if (isZero(a))
			return ZERO();
		return Math.min(a*p, ZERO());
	}
	// anything more than 745 leads to zero ultimately, so that's zero
	public double ZERO(){ return  745;}
	public double ONE() {
		return 0;
	}
	public boolean isZero(double a) {
		return a >= ZERO();
	}
	public String getName() { return "log"; }
	public double realToInternal(double p) throws UnusualConditionException {
		if (Double.isNaN(p) || p < 0)
			throw new UnusualConditionException("Can't represent "+p+" as a log weight");
		if (p == 0)
			return ZERO();
		return Math.min(-Math.log(p), ZERO());
	}
	public double internalToReal(double a) {
		if (isZero(a))
			return 0;
		return Math.exp(-a);
	}
}
