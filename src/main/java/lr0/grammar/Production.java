package lr0.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lr0.util.Utils;

/**
 * A grammar production with a left and a right hand side.
 */
public final class Production {

	/**
	 * Id of the production, the index in the production list of its grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for epsilon productions
	 */
	public final List<Symbol> right;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = Objects.requireNonNull(left);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
	}

	/**
	 * Creates a copy of this production with another id.
	 */
	public Production withId(int id){
		return new Production(id, left, right);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return "ε";
		}
		return Utils.join(right, " ");
	}

	/**
	 * Can this production only be derived to epsilon?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public String toString() {
		return id + " " + left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production) obj;
		return other.id == id && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, left, right);
	}
}
