package com.traffic.counts.aadv;

/**
 * Fields of a count's header row needed to look up correction factors.
 * Any of them may be null.
 */
public class HeaderInfo {

    public int recordNum;
    /**
     * Municipality code; its state prefix picks the factor columns.
     */
    public String mcd;
    /**
     * Road functional classification.
     */
    public Integer fc;
    public String countType;
    public String bikePedGroup;
    public String inDir;
    public String outDir;
}
