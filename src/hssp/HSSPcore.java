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
package hssp;

import java.lang.reflect.Method;
import java.util.Arrays;

import hssp.main.Command;
import hssp.main.CommandsDescriptor;

public class HSSPcore {

	/**
	 * @param args Command id followed by the options and arguments of the command
	 */
	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length == 0 || args[0].equals("help") || args[0].equals("-h") || args[0].equals("--help")){
			descriptor.printUsage();
			return;
		} else if(args[0].equals("version") || args[0].equals("-v") || args[0].equals("--version")){
			descriptor.printVersion();
			return;
		} else if(args[0].equals("citing") || args[0].equals("-c") || args[0].equals("--citing")){
			descriptor.printCiting();
			return;
		}
		Command command = descriptor.getCommand(args[0]);
		if(command == null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			descriptor.printUsage();
			System.exit(1);
		}
		Class<?> program = command.getProgram();
		Method main = program.getDeclaredMethod("main", String[].class);
		String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
		main.invoke(null, (Object)mainArgs);
	}

}
