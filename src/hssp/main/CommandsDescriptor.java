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

import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

/**
 * Commands available in HSSPcore, loaded from an XML descriptor in the classpath
 */
public class CommandsDescriptor {
	public static final String ATTRIBUTE_VERSION="version";
	public static final String ATTRIBUTE_DATE="date";
	public static final String ATTRIBUTE_ID="id";
	public static final String ATTRIBUTE_CLASSNAME="class";
	public static final String ATTRIBUTE_TYPE="type";
	public static final String ATTRIBUTE_DEFAULT_VALUE="default";
	public static final String ATTRIBUTE_ATTRIBUTE="attribute";
	public static final String ATTRIBUTE_GROUPID="groupId";
	public static final String ATTRIBUTE_MULTIPLE="multiple";
	public static final String ELEMENT_COMMAND="command";
	public static final String ELEMENT_COMMANDGROUP="commandgroup";
	public static final String ELEMENT_TITLE="title";
	public static final String ELEMENT_INTRO="intro";
	public static final String ELEMENT_DESCRIPTION="description";
	public static final String ELEMENT_ARGUMENT="argument";
	public static final String ELEMENT_OPTION="option";

	private static final String RESOURCE = "/hssp/main/CommandsDescriptor.xml";

	private String swVersion;
	private String releaseDate;
	private String swTitle;
	private Map<String,List<Command>> commandsByGroup = new HashMap<String,List<Command>>();
	private Map<String,Command> commandsByClass = new HashMap<String,Command>();
	private Map<String,Command> commandsById = new HashMap<String,Command>();
	private Map<String, String> commandGroupNames = new LinkedHashMap<String, String>();
	private static CommandsDescriptor instance = new CommandsDescriptor();

	private CommandsDescriptor () {
		load();
	}
	public static CommandsDescriptor getInstance() {
		return instance;
	}

	private void load() {
		Document doc;
		try (InputStream is = this.getClass().getResourceAsStream(RESOURCE)) {
			if(is==null) throw new RuntimeException("Commands descriptor "+RESOURCE+" not found in the classpath");
			DocumentBuilder documentBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
			doc = documentBuilder.parse(new InputSource(is));
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new RuntimeException("Can not load commands descriptor "+RESOURCE, e);
		}
		Element rootElement = doc.getDocumentElement();
		swVersion = rootElement.getAttribute(ATTRIBUTE_VERSION);
		releaseDate = rootElement.getAttribute(ATTRIBUTE_DATE);
		NodeList offspring = rootElement.getChildNodes();
		for(int i=0;i<offspring.getLength();i++){
			Node node = offspring.item(i);
			if (!(node instanceof Element)) continue;
			Element elem = (Element)node;
			if(ELEMENT_COMMANDGROUP.equals(elem.getNodeName())) {
				String id = elem.getAttribute(ATTRIBUTE_ID);
				if(id.length()==0) throw new RuntimeException("Every command group must have an id");
				commandGroupNames.put(id,loadText(elem));
				commandsByGroup.put(id,new ArrayList<Command>());
			} else if(ELEMENT_COMMAND.equals(elem.getNodeName())) {
				Command c;
				try {
					c = loadCommand(elem);
				} catch (RuntimeException e) {
					throw new RuntimeException("Can not load command with id "+elem.getAttribute(ATTRIBUTE_ID),e);
				}
				List<Command> commandsList = commandsByGroup.get(c.getGroupId());
				if(commandsList==null)  throw new RuntimeException("Group "+c.getGroupId()+" not registered for command with id: "+c.getId());
				if(commandsById.containsKey(c.getId())) throw new RuntimeException("Duplicated command id: "+c.getId());
				commandsById.put(c.getId(),c);
				commandsList.add(c);
				commandsByClass.put(c.getProgram().getName(), c);
			} else if(ELEMENT_TITLE.equals(elem.getNodeName())) {
				swTitle = loadText(elem);
			}
		}
	}

	private Command loadCommand(Element cmdElem) {
		String id = cmdElem.getAttribute(ATTRIBUTE_ID);
		if(id.length()==0) throw new RuntimeException("Every command must have an id");
		String className = cmdElem.getAttribute(ATTRIBUTE_CLASSNAME);
		if(className.length()==0) throw new RuntimeException("Every command must have a class name");
		Class<?> program;
		try {
			program = Class.forName(className);
			program.getDeclaredMethod("main",String[].class);
		} catch (ClassNotFoundException e) {
			throw new RuntimeException("Can not load class for command: "+id,e);
		} catch (NoSuchMethodException e) {
			throw new RuntimeException("Class "+className+" for command: "+id+" does not have a main method",e);
		}
		Command cmd = new Command(id,program);
		cmd.setGroupId(cmdElem.getAttribute(ATTRIBUTE_GROUPID));
		NodeList offspring = cmdElem.getChildNodes();
		for(int i=0;i<offspring.getLength();i++){
			Node node = offspring.item(i);
			if (!(node instanceof Element)) continue;
			Element elem = (Element)node;
			if(ELEMENT_TITLE.equals(elem.getNodeName())) {
				cmd.setTitle(loadText(elem));
			} else if(ELEMENT_INTRO.equals(elem.getNodeName())) {
				cmd.setIntro(loadText(elem));
			} else if(ELEMENT_DESCRIPTION.equals(elem.getNodeName())) {
				cmd.setDescription(loadText(elem));
			} else if(ELEMENT_ARGUMENT.equals(elem.getNodeName())) {
				boolean multiple = "true".equals(elem.getAttribute(ATTRIBUTE_MULTIPLE).trim().toLowerCase());
				cmd.addArgument(loadText(elem),multiple);
			} else if(ELEMENT_OPTION.equals(elem.getNodeName())) {
				cmd.addOption(loadOption(elem));
			}
		}
		return cmd;
	}

	private CommandOption loadOption(Element elem) {
		String optId = elem.getAttribute(ATTRIBUTE_ID);
		if(optId.length()==0) throw new RuntimeException("Every option must have an id");
		CommandOption opt = new CommandOption(optId);
		String optType = elem.getAttribute(ATTRIBUTE_TYPE);
		if(optType.length()>0) opt.setType(optType);
		String optDefault = elem.getAttribute(ATTRIBUTE_DEFAULT_VALUE);
		if(optDefault.trim().length()>0) opt.setDefaultValue(optDefault);
		String optAttribute = elem.getAttribute(ATTRIBUTE_ATTRIBUTE);
		if(optAttribute.trim().length()>0) opt.setAttribute(optAttribute);
		String description = loadText(elem);
		if(description==null || description.length()==0) throw new RuntimeException("Option "+optId+" does not have a description");
		opt.setDescription(description);
		return opt;
	}

	private String loadText(Element elem) {
		NodeList offspring = elem.getChildNodes();
		for (int i=0; i < offspring.getLength(); i++) {
			Node subnode = offspring.item(i);
			if (subnode.getNodeType() == Node.TEXT_NODE) {
				String desc = subnode.getNodeValue();
				if(desc!=null) return desc.trim().replaceAll("\\s+", " ");
			}
		}
		return null;
	}
	public String getSwVersion() {
		return swVersion;
	}
	public String getReleaseDate() {
		return releaseDate;
	}
	public Command getCommand(String name) {
		return commandsById.get(name);
	}
	public Command getCommandByClass(String classname) {
		return commandsByClass.get(classname);
	}

	/**
	 * Prints the general usage including the command names and intro information
	 */
	public void printUsage(){
		System.err.println();
		printVersionHeader();
		System.err.println("=============================================================================");
		System.err.println();
		System.err.println("USAGE: java -jar HSSPcore_"+swVersion+".jar <COMMAND> <OPTIONS> <ARGUMENTS>");
		System.err.println();
		for(String commandGroupId:commandGroupNames.keySet()) {
			System.err.println("Commands for "+commandGroupNames.get(commandGroupId));
			System.err.println();
			for(Command c:commandsByGroup.get(commandGroupId)) {
				System.err.println("  > " + c.getId());
				System.err.println("          "+c.getIntro());
			}
			System.err.println();
		}
	}
	private void printVersionHeader() {
		System.err.println(" HSSPcore - "+swTitle);
		System.err.println(" Version " + swVersion + " ("+releaseDate+")");
	}
	/**
	 * Prints the help of the command implemented by the given class
	 * @param program Class implementing a command
	 */
	public void printHelp(Class<?> program) {
		printHelp(commandsByClass.get(program.getName()));
	}
	public void printHelp(Command c) {
		String line = "-".repeat(c.getTitle().length());
		System.err.println(line);
		System.err.println(c.getTitle());
		System.err.println(line);
		System.err.println();
		System.err.println(c.getDescription());
		System.err.println();
		System.err.println("USAGE:");
		System.err.println();
		System.err.print("java -jar HSSPcore_"+swVersion+".jar "+ c.getId()+" <OPTIONS>");
		for(String arg:c.getArguments()) {
			System.err.print(" <"+arg+">");
			if(c.isMultiple(arg)) System.err.print("*");
		}
		System.err.println();
		System.err.println();
		System.err.println("OPTIONS:");
		System.err.println();
		List<CommandOption> options = c.getOptionsList();
		int longestOpt = 0;
		for(CommandOption opt:options) longestOpt = Math.max(longestOpt, opt.getPrintLength());
		for(CommandOption option:options) {
			StringBuilder optLine = new StringBuilder("        -"+option.getId());
			if(!option.isFlag()) optLine.append(" "+option.getType());
			int diff = longestOpt-option.getPrintLength();
			optLine.append(" ".repeat(diff+1));
			optLine.append(": ");
			optLine.append(option.getDescription());
			if(option.getDefaultValue()!=null) optLine.append(" Default: "+option.getDefaultValue());
			System.err.println(optLine);
		}
		System.err.println();
	}
	/**
	 * Prints the version plus general usage
	 */
	public void printVersion() {
		System.err.println();
		printVersionHeader();
		System.err.println();
		System.err.println(" For usage type     java -jar HSSPcore_"+swVersion+".jar --help");
		System.err.println();
	}
	/**
	 * Prints the citing information
	 */
	public void printCiting(){
		System.err.println("------");
		System.err.println("Citing");
		System.err.println("------");
		System.err.println();
		System.err.println("The HSSP format and the homology threshold are described in:");
		System.err.println();
		System.err.println("Sander C and Schneider R. (1991)");
		System.err.println("Database of homology-derived protein structures and the structural meaning of sequence alignment.");
		System.err.println("Proteins 9(1): 56-68.");
		System.err.println();
	}

	/**
	 * Loads the options given for a command in the object implementing it
	 * @param programInstance Object implementing one command
	 * @param args Arguments sent by the user
	 * @return int Index of the first positional argument in the arguments array
	 */
	public int loadOptions(Object programInstance, String [] args ) throws Exception {
		if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")){
			printHelp(programInstance.getClass());
			System.exit(1);
		}
		Command c = commandsByClass.get(programInstance.getClass().getName());
		if(c==null) throw new RuntimeException("Class "+programInstance.getClass().getName()+" is not registered as a command");
		int i = 0;
		while(i<args.length && args[i].length()>1 && args[i].charAt(0)=='-') {
			CommandOption o = c.getOption(args[i].substring(1));
			if (o==null) {
				System.err.println("Unrecognized option "+args[i]);
				printHelp(c);
				System.exit(1);
			}
			Method setter = o.findSetMethod(programInstance);
			Object value=null;
			if(o.isFlag()) {
				value = true;
			} else {
				i++;
				if(i==args.length) {
					System.err.println("Missing value for option "+args[i-1]);
					printHelp(c);
					System.exit(1);
				}
				if(setter.getParameterTypes()[0].equals(String.class)) {
					value = args[i];
				} else {
					try {
						value = o.decodeValue(args[i]);
					} catch (NumberFormatException e) {
						System.err.println("Error loading value \""+args[i]+"\" for option \""+o.getId()+"\" of type "+o.getType()+": "+e.getMessage());
						printHelp(c);
						System.exit(1);
					}
				}
			}
			try {
				setter.invoke(programInstance, value);
			} catch (IllegalAccessException | IllegalArgumentException | InvocationTargetException e) {
				System.err.println("Error setting value \""+value+"\" for option \""+o.getId()+"\" of type: "+o.getType()+". "+e.getMessage());
				e.printStackTrace();
				System.exit(1);
			}
			i++;
		}
		return i;
	}
}
