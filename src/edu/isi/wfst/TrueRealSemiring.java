package edu.isi.wfst;

// real is +, *, 0, 1
// lots of underflows, but handy for checking the functionality of RealSemiring
public class TrueRealSemiring extends Semiring {
	private static final long serialVersionUID = 1L;

	public double plus(double a, double b) {
		return a+b;
	}
	public double times(double a, double b) {
		double prod = a*b;
		// don't let two positive weights underflow to zero
		if (prod == 0 && a > 0 && b > 0) {
			if (a > b)
				return b;
			return a;
		}
		return prod;
	}
	public double divide(double a, double b) throws UnusualConditionException {
		if (b == 0)
			throw new UnusualConditionException("Tried to divide "+a+" by zero");
		return a/b;
	}
	public double power(double a, double p) {
		if (p == 0)
			return ONE();
		return Math.pow(a, p);
	}
	public double ZERO(){return 0;}
	public double ONE() {return 1;}
	public String getName() { return "real"; }

	public double realToInternal(double p) throws UnusualConditionException {
		if (Double.isNaN(p))
			throw new UnusualConditionException("Can't represent NaN as a real weight");
		return p;
	}
	public double internalToReal(double a) { return a;}
}
