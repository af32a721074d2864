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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command available from the command line, with the class implementing it and the description of its
 * options and positional arguments
 */
public class Command {
	private final String id;
	private final Class<?> program;
	private String title;
	private String intro;
	private String description;
	private String groupId;

	// Value tells if the argument can be repeated
	private Map<String,Boolean> arguments = new LinkedHashMap<String,Boolean>();
	private Map<String, CommandOption> options = new LinkedHashMap<String,CommandOption>();

	public Command(String id, Class<?> program) {
		this.id = id;
		this.program = program;
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getTitle() {
		return title;
	}
	public void setTitle(String title) {
		this.title = title;
	}
	public String getIntro() {
		return intro;
	}
	public void setIntro(String intro) {
		this.intro = intro;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getGroupId() {
		return groupId;
	}
	public void setGroupId(String groupId) {
		this.groupId = groupId;
	}
	public List<String> getArguments() {
		return new ArrayList<String>(arguments.keySet());
	}
	public boolean isMultiple(String argument) {
		Boolean mult = arguments.get(argument);
		return mult!=null && mult.booleanValue();
	}
	public void addArgument(String argument, boolean multiple) {
		arguments.put(argument, multiple);
	}
	public List<CommandOption> getOptionsList() {
		return new ArrayList<CommandOption>(options.values());
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new IllegalArgumentException("Duplicated option id: "+option.getId()+" for command "+id);
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
}
