package lr0.automaton;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of items in canonical order (production id, then dot position).
 *
 * Item sets with the same items are equal, regardless of the order the items were added in. The item set of a
 * state is its identity in the automaton.
 */
public final class ItemSet implements Iterable<Item> {

	private static final ItemSet EMPTY = new ItemSet(Collections.emptyList());

	private final List<Item> items;

	private ItemSet(List<Item> sortedItems) {
		this.items = Collections.unmodifiableList(sortedItems);
	}

	public static ItemSet of(Collection<Item> items){
		if (items.isEmpty()){
			return EMPTY;
		}
		return new ItemSet(new ArrayList<>(new TreeSet<>(items)));
	}

	public static ItemSet of(Item... items){
		return of(Arrays.asList(items));
	}

	public static ItemSet empty(){
		return EMPTY;
	}

	public int size(){
		return items.size();
	}

	public boolean isEmpty(){
		return items.isEmpty();
	}

	public boolean contains(Item item){
		return Collections.binarySearch(items, item) >= 0;
	}

	/**
	 * Items in canonical order
	 */
	public List<Item> asList(){
		return items;
	}

	public Stream<Item> stream(){
		return items.stream();
	}

	/**
	 * Items whose dot is at the end of their production
	 */
	public List<Item> completedItems(){
		return items.stream().filter(Item::atEnd).collect(Collectors.toList());
	}

	/**
	 * Ids of the productions that are completed in this set, ascending
	 */
	public List<Integer> completedProductionIndices(){
		return items.stream().filter(Item::atEnd).map(i -> i.production.id).distinct().sorted()
				.collect(Collectors.toList());
	}

	@Override
	public Iterator<Item> iterator() {
		return items.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ItemSet && ((ItemSet) obj).items.equals(items);
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int j = 0; j < items.size(); j++) {
			if (j != 0){
				builder.append("\n");
			}
			builder.append("- ").append(items.get(j));
		}
		return builder.toString();
	}
}
