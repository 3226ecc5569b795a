package name.monarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Monarchy {

    public static final String ENGINE_ID = "monarchy";
    public static final Logger LOGGER = LoggerFactory.getLogger(ENGINE_ID);

    private Monarchy() {}
}
