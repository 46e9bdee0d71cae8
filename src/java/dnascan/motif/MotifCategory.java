package dnascan.motif;

/**
 * Category of a known motif
 */
public enum MotifCategory {
	
	/**
	 * Promoter and translation initiation elements
	 */
	PROMOTER,
	
	/**
	 * Restriction enzyme recognition sites
	 */
	RESTRICTION_SITE,
	
	/**
	 * Methylation sites
	 */
	CPG_SITE;
	
	/**
	 * Get a comma separated list of all available names
	 * @return List of available names
	 */
	public static String commaSeparatedList() {
		String rtrn = "";
		for(int i = 0; i < values().length; i++) {
			if(i > 0) {
				rtrn += ", ";
			}
			rtrn += values()[i];
		}
		return rtrn;
	}
	
	/**
	 * Create from string
	 * @param name Name
	 * @return Object corresponding to this name
	 */
	public static MotifCategory fromString(String name) {
		for(MotifCategory c : values()) {
			if(name.equals(c.toString())) {
				return c;
			}
		}
		throw new IllegalArgumentException("Category " + name + " not recognized. Options: " + commaSeparatedList());
	}
	
	@Override
	public String toString() {
		switch(this) {
		case PROMOTER:
			return "promoters";
		case RESTRICTION_SITE:
			return "restrictions";
		case CPG_SITE:
			return "cpg_sites";
		default:
			throw new IllegalStateException("Element not supported.");
		}
	}

}
