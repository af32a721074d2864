/*******************************************************************************
 * HSSPcore - Homology-derived Secondary Structure of Proteins
 * Copyright 2016 Jorge Duitama
 *
 * This file is part of HSSPcore.
 *
 *     HSSPcore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     HSSPcore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with HSSPcore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package hssp.main;

/**
 * Decodes the values given for command options
 */
public class OptionValuesDecoder {
	public static Object decode (String value, Class<?> type) {
		if(Integer.class.equals(type)) {
			return Integer.parseInt(value);
		}
		if(Double.class.equals(type)) {
			return Double.parseDouble(value);
		}
		if(Boolean.class.equals(type)) {
			return Boolean.parseBoolean(value);
		}
		if(String.class.equals(type)) {
			return value;
		}
		throw new IllegalArgumentException("Can not decode value of type: "+type.toString());
	}

	/**
	 * Decodes a chain id given as an option value
	 * @param value String that must have exactly one character
	 * @return char chain id
	 */
	public static char decodeChainId(String value) {
		if(value==null || value.length()!=1) throw new IllegalArgumentException("Chain ids must have one character. Invalid value: "+value);
		return value.charAt(0);
	}
}
