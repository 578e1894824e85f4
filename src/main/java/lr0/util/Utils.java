package lr0.util;

import java.util.List;

/**
 * String helpers shared by the reports and the graphviz export
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	public static String escapeHtml(String text){
		String ret = text + "";
		String[] search = new String[]{"&", "\"", "<", ">"};
		String[] replacement = new String[]{"&amp;", "&quot;", "&lt;", "&gt;"};
		for (int i = 0; i < search.length; i++){
			ret = ret.replace(search[i], replacement[i]);
		}
		return ret;
	}
}
