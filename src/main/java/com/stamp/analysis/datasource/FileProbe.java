package com.stamp.analysis.datasource;

/**
 * What a cheap look at a file reveals before it is fully read: how many integrations it claims to hold and the
 * timestamp of the first one (NaN if it could not be determined). Used to order files and to estimate total work.
 */
public record FileProbe (int integrationCount, double firstTime) {

}
