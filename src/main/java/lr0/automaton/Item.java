package lr0.automaton;

import lr0.grammar.*;
import lr0.util.Utils;

/**
 * A production with a marker (the dot) that denotes how much of its right hand side is already parsed.
 *
 * Two items are equal if their production ids and dot positions are equal.
 */
public final class Item implements Comparable<Item> {

	public final Production production;

	/**
	 * The dot is before the $position.th right hand side symbol
	 */
	public final int position;

	public Item(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(
					String.format("Dot position %d is outside of production %s", position, production));
		}
		this.production = production;
		this.position = position;
	}

	public Item(Production production){
		this(production, 0);
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	/**
	 * Is the whole right hand side consumed? True for epsilon productions at position 0.
	 */
	public boolean atEnd(){
		return !canAdvance();
	}

	public Item advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Item(production, position + 1);
	}

	/**
	 * @return symbol right after the dot or {@code null} if the item is at its end
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	public boolean inFrontOf(Symbol symbol){
		return canAdvance() && nextSymbol().equals(symbol);
	}

	public boolean inFrontOfTerminal(){
		return canAdvance() && nextSymbol().isTerminal();
	}

	public boolean inFrontOfNonTerminal(){
		return canAdvance() && nextSymbol().isNonTerminal();
	}

	public String formatRightSide() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < position; i++) {
			builder.append(production.right.get(i)).append(" ");
		}
		builder.append("·");
		for (int i = position; i < production.rightSize(); i++) {
			builder.append(" ").append(production.right.get(i));
		}
		return builder.toString();
	}

	public String toHTMLString(){
		StringBuilder builder = new StringBuilder();
		builder.append(production.id).append(" ").append(Utils.escapeHtml(production.left.toString()));
		builder.append(" → ");
		for (int i = 0; i < position; i++) {
			builder.append(Utils.escapeHtml(production.right.get(i).toString()));
			builder.append("&#32;");
		}
		builder.append("&bull;");
		for (int i = position; i < production.rightSize(); i++) {
			builder.append("&#32;");
			builder.append(Utils.escapeHtml(production.right.get(i).toString()));
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return production.id + " " + production.left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Item && ((Item) obj).production.id == production.id && ((Item) obj).position == position;
	}

	@Override
	public int hashCode() {
		return production.id * 31 + position;
	}

	@Override
	public int compareTo(Item o) {
		if (o.production.id != production.id){
			return Integer.compare(production.id, o.production.id);
		}
		return Integer.compare(position, o.position);
	}
}
