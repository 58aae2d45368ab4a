package com.peptide_toxicity.util;

public class ValidationUtil {
    public static boolean stringExists(String str){
        return str != null && !str.isBlank();
    }
}
