package org.modfix;

public class FixSettings {
    public Modfix modfix = new Modfix();

    public static class Modfix {
        /** Offer a single action that fixes every diagnostic in the request */
        public boolean offerFixAll = true;

        public String logLevel = "INFO";
    }
}
