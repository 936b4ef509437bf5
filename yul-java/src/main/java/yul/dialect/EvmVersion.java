package yul.dialect;

public enum EvmVersion {
    HOMESTEAD("homestead"),
    TANGERINE_WHISTLE("tangerineWhistle"),
    SPURIOUS_DRAGON("spuriousDragon"),
    BYZANTIUM("byzantium"),
    CONSTANTINOPLE("constantinople"),
    PETERSBURG("petersburg"),
    ISTANBUL("istanbul"),
    BERLIN("berlin"),
    LONDON("london"),
    PARIS("paris"),
    SHANGHAI("shanghai"),
    CANCUN("cancun");

    private final String id;

    EvmVersion(String id) {
        this.id = id;
    }

    public static EvmVersion current() {
        return CANCUN;
    }

    public static EvmVersion fromName(String name) {
        for (EvmVersion v : values()) {
            if (v.id.equals(name)) return v;
        }
        throw new IllegalArgumentException("Unknown EVM version: " + name);
    }

    public String id() {
        return id;
    }

    /** "Istanbul", as used in "Istanbul-compatible VMs". */
    public String displayName() {
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }

    public boolean atLeast(EvmVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return id;
    }
}
