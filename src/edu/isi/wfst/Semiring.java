package edu.isi.wfst;
import java.io.Serializable;
// the general semiring. Subclasses do the operations. Weights are doubles in 
// whatever internal representation the subclass likes; only the subclass may 
// interpret them, everything else goes through these methods
public abstract class Semiring implements Serializable {
	private static final long serialVersionUID = 1L;
	public abstract double plus(double a, double b);
	public abstract double times(double a, double b);
	// a / b. No answer when b is zero
	public abstract double divide(double a, double b) throws UnusualConditionException;
	// a times itself p times (p may be fractional where the algebra allows it)
	public abstract double power(double a, double p);
	public abstract double ZERO();
	public abstract double ONE();
	// name used in type strings and messages
	public abstract String getName();

	// all the semirings here are commutative, so reverse is the identity.
	public double reverse(double a) {
		return a;
	}

	// round to the nearest multiple of delta. zero (and infinities) stay put
	public double quantize(double a, double delta) {
		if (isZero(a) || Double.isInfinite(a) || Double.isNaN(a))
			return a;
		return Math.floor(a/delta + 0.5) * delta;
	}

	// subclasses with a fuzzy zero override this
	public boolean isZero(double a) {
		return a == ZERO();
	}
	public boolean isOne(double a) {
		return a == ONE();
	}
	public boolean equal(double a, double b) {
		if (isZero(a))
			return isZero(b);
		return a == b;
	}
	// approximate equality, for checking results of arithmetic
	public boolean approxEqual(double a, double b, double delta) {
		if (isZero(a) || isZero(b))
			return isZero(a) && isZero(b);
		return Math.abs(a-b) <= delta;
	}

	// standard probabilities in and out of the internal representation
	public abstract double realToInternal(double p) throws UnusualConditionException;
	public abstract double internalToReal(double a);

	// move a weight of semiring "from" into this semiring by way of its real value
	public double convert(double w, Semiring from) throws UnusualConditionException {
		if (from.getClass().equals(getClass()))
			return w;
		if (from.isZero(w))
			return ZERO();
		return realToInternal(from.internalToReal(w));
	}

	// same class means same algebra
	public boolean sameAs(Semiring s) {
		return s != null && s.getClass().equals(getClass());
	}
	public String toString() {
		return getName();
	}
}
