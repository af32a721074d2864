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

import java.lang.reflect.Method;

/**
 * Option of a command. Values are assigned calling the setter of the option attribute in the object
 * implementing the command
 */
public class CommandOption {
	public static final String TYPE_INT = "INT";
	public static final String TYPE_DOUBLE = "DOUBLE";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_BOOLEAN = "BOOLEAN";

	private final String id;
	private String type = TYPE_STRING;
	private String defaultValue=null;
	private String description;
	private String attribute;

	public CommandOption(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public boolean isFlag() {
		return TYPE_BOOLEAN.equals(type);
	}
	/**
	 * @return int Number of characters used to print the option and its type in the help
	 */
	public int getPrintLength() {
		int length = id.length()+9;
		if(!isFlag()) length+=type.length()+1;
		return length;
	}
	/**
	 * Finds the method to set the value of this option. Setters receiving the decoded type are preferred
	 * over setters receiving the value as a String
	 * @param instance Object implementing the command
	 * @return Method setter for the option attribute
	 */
	public Method findSetMethod (Object instance) {
		if(attribute==null) throw new RuntimeException("Attribute not set for option: "+id);
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		Class<?> typeClass = getTypeClass();
		try {
			return instance.getClass().getMethod(methodName,typeClass);
		} catch (NoSuchMethodException e) {
			try {
				return instance.getClass().getMethod(methodName,String.class);
			} catch (NoSuchMethodException e1) {
				throw new RuntimeException("Class "+instance.getClass().getName()+" does not have a setter for option "+id, e);
			}
		}
	}
	Class<?> getTypeClass() {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_DOUBLE.equals(type)) return Double.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type)) return String.class;
		throw new RuntimeException("Can not decode option "+id+" of unrecognized type: "+type);
	}
	public Object decodeValue (String value) {
		return OptionValuesDecoder.decode(value, getTypeClass());
	}
}
